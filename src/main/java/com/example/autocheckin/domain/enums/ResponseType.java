package com.example.autocheckin.domain.enums;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * Classification of what the remote side answered after an action.
 */
@Getter
@RequiredArgsConstructor
public enum ResponseType {

    /**
     * A reply text was extracted
     */
    REPLY("reply"),

    /**
     * The remote side answered with a URL (button callbacks only)
     */
    URL("url"),

    /**
     * The action completed but nothing came back
     */
    NO_REPLY("no-reply");

    private final String code;
}
