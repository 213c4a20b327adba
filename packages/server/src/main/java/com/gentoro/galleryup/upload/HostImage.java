package com.gentoro.galleryup.upload;

/** What an image host reports for one stored image. */
public record HostImage(String galleryId, String imageUrl, String thumbUrl) {}
