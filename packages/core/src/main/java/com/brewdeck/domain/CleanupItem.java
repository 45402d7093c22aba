package com.brewdeck.domain;

/** One file or directory a cleanup would remove, with its size in bytes. */
public record CleanupItem(String path, long size) {}
