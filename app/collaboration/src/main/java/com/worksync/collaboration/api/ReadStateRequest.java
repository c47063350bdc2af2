package com.worksync.collaboration.api;

import jakarta.validation.constraints.NotNull;

public record ReadStateRequest(@NotNull Boolean read) {}
