package com.thorbis.accessservice.api;

import jakarta.validation.constraints.NotBlank;

/** @param version policy version to activate */
public record PolicyReloadRequest(@NotBlank String version) {}
