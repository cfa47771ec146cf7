package com.forenx.sentinel.normalization.parsers;

import java.util.List;

/**
 * Formats recognised out of the box, most specific first.
 */
public final class BuiltinFormats {

    private static final String PREFIX =
        "(?<ip>\\S+) \\S+ (?<user>\\S+) \\[(?<timestamp>[^\\]]+)\\] \"(?<request>[^\"]*)\" (?<status>\\S+) (?<bytes>\\S+)";

    private static final String REFERRER_AND_AGENT = " \"(?<referrer>[^\"]*)\" \"(?<useragent>[^\"]*)\"";

    private static final String REQUEST_TIME = "(?: (?<requesttime>\\d+(?:\\.\\d+)?))?";

    public static final FormatDefinition JSON = FormatDefinition.json("json", 10);

    public static final FormatDefinition EXTENDED = FormatDefinition.regex("extended",
        PREFIX + REFERRER_AND_AGENT + " \"(?<host>[^\"]*)\"" + REQUEST_TIME, 20, FormatDefinition.Mode.STRICT);

    public static final FormatDefinition COMBINED = FormatDefinition.regex("combined",
        PREFIX + REFERRER_AND_AGENT + REQUEST_TIME, 30, FormatDefinition.Mode.STRICT);

    public static final FormatDefinition COMMON = FormatDefinition.regex("common",
        PREFIX, 40, FormatDefinition.Mode.STRICT);

    private BuiltinFormats() {
    }

    public static List<FormatDefinition> all() {
        return List.of(JSON, EXTENDED, COMBINED, COMMON);
    }
}
