package com.scholary.channel.insights.api;

/** Error body returned by every endpoint. */
public record ErrorResponse(String error, String details) {}
