package com.worksync.collaboration.api;

public record ApiErrorResponse(String code, String message) {}
