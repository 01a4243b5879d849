package com.gentoro.citations.model;

/**
 * Author comment placed right after a link, either {@code %%text%%} or {@code <!-- text -->}.
 *
 * @param fullMatch marker including its delimiters
 * @param innerText trimmed text between the delimiters
 */
public record ExtractionMarker(String fullMatch, String innerText) {}
