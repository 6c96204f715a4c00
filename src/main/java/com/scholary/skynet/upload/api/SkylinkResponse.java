package com.scholary.skynet.upload.api;

/** A validated skylink in both its bare and {@code sia://} forms. */
public record SkylinkResponse(String skylink, String skylinkUri, int bitfield) {}
