package com.ocadapter.service.impl.dto;

/**
 * Text of the assistant reply and wall-clock milliseconds spent from submission to reply.
 */
public record ExchangeResult(String content, long elapsedMs) {
}
