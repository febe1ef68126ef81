package com.harvester.api;

public enum MessageFilter {
    ALL,
    // Only messages that carry at least one URL
    URL
}
