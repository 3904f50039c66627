package org.netpreserve.evidence;

import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Identifies a post by its author's screen name and the platform's numeric status id. The status id alone is
 * unique; the screen name is what the archive's URLs are keyed by.
 */
public record PostId(String screenName, long statusId) implements Comparable<PostId> {
    private static final Pattern STATUS_URL = Pattern.compile(
            "^(?:https?://)?(?:(?:www|mobile)\\.)?(?:twitter|x)\\.com(?::\\d+)?/([^/?#]+)/status(?:es)?/(\\d+)(?:[/?#].*)?$",
            Pattern.CASE_INSENSITIVE);
    private static final Pattern SCREEN_AND_ID = Pattern.compile("^([A-Za-z0-9_]+)/(\\d+)$");

    public PostId {
        if (screenName == null || screenName.isBlank()) throw new IllegalArgumentException("screen name is required");
        if (statusId <= 0) throw new IllegalArgumentException("status id must be positive");
    }

    /**
     * Parses a status URL or {@code screen/12345}. A bare id is rejected: captures are keyed by screen name, so
     * there would be nothing to look up.
     */
    public static PostId parse(String text) {
        String trimmed = text.trim();
        if (!trimmed.isEmpty() && trimmed.chars().allMatch(Character::isDigit)) {
            throw new IllegalArgumentException("Bare status id " + trimmed
                    + " has no screen name; use SCREEN/" + trimmed + " or a status URL");
        }
        Matcher m = SCREEN_AND_ID.matcher(trimmed);
        if (m.matches()) return new PostId(m.group(1), parseId(m.group(2), text));
        return fromUrl(trimmed).orElseThrow(() -> new IllegalArgumentException("Not a post identifier: " + text));
    }

    /**
     * Extracts the post from a status URL as found in CDX rows, if it is one.
     */
    public static Optional<PostId> fromUrl(String url) {
        Matcher m = STATUS_URL.matcher(url);
        if (!m.matches()) return Optional.empty();
        try {
            return Optional.of(new PostId(m.group(1), Long.parseLong(m.group(2))));
        } catch (NumberFormatException e) {
            return Optional.empty();
        }
    }

    private static long parseId(String digits, String original) {
        try {
            return Long.parseLong(digits);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Status id out of range: " + original);
        }
    }

    public String url() {
        return "https://twitter.com/" + screenName + "/status/" + statusId;
    }

    /**
     * Archive lookup key. Captures are indexed under whatever screen name was in the URL when archived.
     */
    public String cdxQuery() {
        return "twitter.com/" + screenName + "/status/" + statusId;
    }

    @Override
    public int compareTo(PostId o) {
        return Long.compare(statusId, o.statusId);
    }

    @Override
    public String toString() {
        return screenName + "/" + statusId;
    }
}
