package com.worksync.collaboration.api;

public record UnreadCountResponse(long count) {}
