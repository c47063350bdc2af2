package com.worksync.collaboration.api;

public record MarkAllReadResponse(int updated) {}
