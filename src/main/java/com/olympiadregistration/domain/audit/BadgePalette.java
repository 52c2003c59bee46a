package com.olympiadregistration.domain.audit;

/**
 * Name-badge colours for a role, as six-digit hex strings without '#'.
 */
public record BadgePalette(String outer, String inner, String text) {
}
