package com.chatsentinel.botcore.model;

public record MediaRef(String url, String mimeType) {}
