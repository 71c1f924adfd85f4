package com.libragraph.backup.types.model;

public record StickerRef(
        String packId,
        String packKey,
        int stickerId,
        String emoji
) {}
