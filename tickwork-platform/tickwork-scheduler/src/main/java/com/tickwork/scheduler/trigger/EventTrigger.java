package com.tickwork.scheduler.trigger;

import java.util.regex.Pattern;

/**
 * Events from one feed whose type matches a glob pattern.
 */
public record EventTrigger(String source, String glob, Pattern pattern) implements TriggerSpec {

    public boolean matches(String eventType) {
        return eventType != null && pattern.matcher(eventType).matches();
    }

    /**
     * Compiles a glob where {@code *} matches any run of characters and
     * {@code ?} a single character. Everything else is literal.
     */
    public static Pattern compileGlob(String glob) {
        StringBuilder regex = new StringBuilder();
        StringBuilder literal = new StringBuilder();
        for (char c : glob.toCharArray()) {
            if (c == '*' || c == '?') {
                if (literal.length() > 0) {
                    regex.append(Pattern.quote(literal.toString()));
                    literal.setLength(0);
                }
                regex.append(c == '*' ? ".*" : ".");
            } else {
                literal.append(c);
            }
        }
        if (literal.length() > 0) {
            regex.append(Pattern.quote(literal.toString()));
        }
        return Pattern.compile(regex.toString());
    }

    @Override
    public String describe() {
        return "event[" + source + " ~ " + glob + "]";
    }
}
