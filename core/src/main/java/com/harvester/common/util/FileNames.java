package com.harvester.common.util;

import java.net.URI;

public final class FileNames {

    private FileNames() {
    }

    /**
     * File name for a downloaded resource: the last path segment of the URL,
     * query and fragment removed.
     */
    public static String fromUrl(String url) {
        String path;
        try {
            path = URI.create(url).getPath();
        } catch (IllegalArgumentException e) {
            path = url;
            if (path.contains("?")) path = path.substring(0, path.indexOf('?'));
            if (path.contains("#")) path = path.substring(0, path.indexOf('#'));
        }
        if (path == null) path = "";
        while (path.endsWith("/")) path = path.substring(0, path.length() - 1);

        String name = sanitize(path.substring(path.lastIndexOf('/') + 1));
        return name.isEmpty() ? "unnamed" : name;
    }

    /**
     * Replace characters that are not safe in file names on common file systems.
     */
    public static String sanitize(String name) {
        if (name == null) return "";
        String clean = name.replaceAll("[\\\\/:*?\"<>|\\p{Cntrl}]", "_");
        if (clean.equals(".") || clean.equals("..")) return "_";
        return clean;
    }
}
