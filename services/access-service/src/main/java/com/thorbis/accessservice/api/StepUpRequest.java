package com.thorbis.accessservice.api;

import jakarta.validation.constraints.NotBlank;

/** @param mfaLevel second factor the front door has just verified for the session's user */
public record StepUpRequest(@NotBlank String mfaLevel) {}
