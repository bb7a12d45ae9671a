package com.eainde.safepulse.confidence;

public final class EscalationLevels {

    private EscalationLevels() {
    }

    /** Highest level whose threshold the score reaches; the lowest level otherwise. */
    public static <L extends Enum<L> & EscalationLevel> L levelFor(Class<L> levelType, int score) {
        L[] levels = levelType.getEnumConstants();
        for (int i = levels.length - 1; i > 0; i--) {
            if (score >= levels[i].threshold()) {
                return levels[i];
            }
        }
        return levels[0];
    }

    public static <L extends Enum<L> & EscalationLevel> L lowest(Class<L> levelType) {
        return levelType.getEnumConstants()[0];
    }

    public static <L extends Enum<L> & EscalationLevel> L highest(Class<L> levelType) {
        L[] levels = levelType.getEnumConstants();
        return levels[levels.length - 1];
    }
}
