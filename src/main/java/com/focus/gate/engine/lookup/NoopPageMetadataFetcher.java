package com.focus.gate.engine.lookup;

import com.focus.gate.dto.PageMetadata;

import java.util.Optional;

public class NoopPageMetadataFetcher implements PageMetadataFetcher {

    @Override
    public Optional<PageMetadata> fetch(String url) {
        return Optional.empty();
    }
}
