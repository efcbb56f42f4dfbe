package com.example.clipscore_backend.model;

public record ChannelInfo(long subscriberCount, long videoCount, String description) {

    public ChannelInfo {
        description = description == null ? "" : description;
    }
}
