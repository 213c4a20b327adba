package com.gentoro.galleryup.coordination;

/** A (gallery, host) pair currently holding an upload slot. */
public record ActiveUpload(String galleryId, String host) {}
