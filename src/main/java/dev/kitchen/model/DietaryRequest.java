package dev.kitchen.model;

import java.util.Arrays;
import java.util.EnumSet;
import java.util.Locale;
import java.util.Set;

/**
 * Independent dietary accommodation flags. Any combination may be set.
 */
public record DietaryRequest(
    boolean vegetarian,
    boolean vegan,
    boolean glutenFree,
    boolean nutFree,
    boolean lowSodium,
    boolean lowSugar
) {

    /** Flag names as accepted on the command line. */
    public enum Flag {
        VEGETARIAN("vegetarian"),
        VEGAN("vegan"),
        GLUTEN_FREE("gluten-free"),
        NUT_FREE("nut-free"),
        LOW_SODIUM("low-sodium"),
        LOW_SUGAR("low-sugar");

        private final String key;

        Flag(String key) {
            this.key = key;
        }

        public String key() {
            return key;
        }

        public static Flag fromKey(String key) {
            String normalized = key.trim().toLowerCase(Locale.ROOT).replace('_', '-');
            for (Flag flag : values()) {
                if (flag.key.equals(normalized)) {
                    return flag;
                }
            }
            throw new IllegalArgumentException("Unknown dietary flag '%s'. Valid flags: %s"
                .formatted(key, validKeys()));
        }

        private static String validKeys() {
            var sb = new StringBuilder();
            for (Flag flag : values()) {
                if (sb.length() > 0) {
                    sb.append(", ");
                }
                sb.append(flag.key);
            }
            return sb.toString();
        }
    }

    public static DietaryRequest none() {
        return new DietaryRequest(false, false, false, false, false, false);
    }

    public static DietaryRequest of(Flag... flags) {
        Set<Flag> set = EnumSet.noneOf(Flag.class);
        set.addAll(Arrays.asList(flags));
        return fromFlags(set);
    }

    /**
     * Parse a comma-separated flag list such as {@code "vegan,nut-free"}. Blank input yields {@link #none()}.
     */
    public static DietaryRequest parse(String flags) {
        Set<Flag> set = EnumSet.noneOf(Flag.class);
        if (flags != null) {
            for (String token : flags.split(",")) {
                if (!token.isBlank()) {
                    set.add(Flag.fromKey(token));
                }
            }
        }
        return fromFlags(set);
    }

    public boolean isEmpty() {
        return !(vegetarian || vegan || glutenFree || nutFree || lowSodium || lowSugar);
    }

    private static DietaryRequest fromFlags(Set<Flag> flags) {
        return new DietaryRequest(
            flags.contains(Flag.VEGETARIAN),
            flags.contains(Flag.VEGAN),
            flags.contains(Flag.GLUTEN_FREE),
            flags.contains(Flag.NUT_FREE),
            flags.contains(Flag.LOW_SODIUM),
            flags.contains(Flag.LOW_SUGAR)
        );
    }
}
