package com.harvester.core.fetch;

import com.harvester.common.util.FileNames;
import com.harvester.core.link.ChannelPostAddress;
import com.harvester.core.link.ClassifiedLink;

import java.nio.file.Path;

/**
 * A link together with the root it is stored under. The folder is derived from
 * the link alone so every run writes the same link to the same place.
 */
public record FetchTarget(ClassifiedLink link, Path destinationRoot) {

    public Path folder() {
        if (link.kind().isPage()) {
            return destinationRoot.resolve(FileNames.sanitize(link.lastPathSegment()));
        }
        return destinationRoot.resolve(ChannelPostAddress.parse(link.url()).folderName());
    }
}
