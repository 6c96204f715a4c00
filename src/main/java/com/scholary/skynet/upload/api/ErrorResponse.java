package com.scholary.skynet.upload.api;

public record ErrorResponse(String error, String message) {}
