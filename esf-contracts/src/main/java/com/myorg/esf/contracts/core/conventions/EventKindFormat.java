package com.myorg.esf.contracts.core.conventions;

import java.util.regex.Pattern;

public final class EventKindFormat {
    private EventKindFormat() {}

    // <domain>.<entity>.<action>.v<major>, e.g. rpg.character.leveled-up.v1
    public static final String RECOMMENDED_PATTERN = "<domain>.<entity>.<action>.v<major>";

    private static final Pattern KIND = Pattern.compile("^[a-z0-9-]+(\\.[a-z0-9-]+)+\\.v[0-9]+$");

    public static boolean isWellFormed(String eventKind) {
        return eventKind != null && KIND.matcher(eventKind).matches();
    }

    public static String requireWellFormed(String eventKind) {
        if (!isWellFormed(eventKind)) {
            throw new IllegalArgumentException(
                    "eventKind '" + eventKind + "' does not follow " + RECOMMENDED_PATTERN);
        }
        return eventKind;
    }

    /** "rpg.character.leveled-up.v1" gives "rpg.character": the tag minus action and version. */
    public static String aggregateKindOf(String eventKind) {
        requireWellFormed(eventKind);
        int versionDot = eventKind.lastIndexOf('.');
        int actionDot = eventKind.lastIndexOf('.', versionDot - 1);
        return actionDot < 0 ? eventKind.substring(0, versionDot) : eventKind.substring(0, actionDot);
    }
}
