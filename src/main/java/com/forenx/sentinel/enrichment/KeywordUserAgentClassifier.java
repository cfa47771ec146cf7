package com.forenx.sentinel.enrichment;

import com.forenx.sentinel.domain.UserAgentClass;

import java.util.List;
import java.util.Locale;

/**
 * Classifies user agents by keyword. Automated clients (crawlers, HTTP libraries, CLI tools)
 * are {@link UserAgentClass#BOT}; anything carrying a browser engine token is a browser.
 */
public class KeywordUserAgentClassifier implements UserAgentClassifier {

    static final List<String> BOT_KEYWORDS = List.of(
        "bot", "crawler", "spider", "scraper", "slurp", "curl", "wget", "python-requests",
        "python-urllib", "java/", "go-http-client", "node-fetch", "apache-httpclient", "okhttp",
        "libwww-perl", "httpie", "nikto", "sqlmap", "nmap", "masscan", "zgrab");

    static final List<String> BROWSER_KEYWORDS = List.of(
        "mozilla/", "applewebkit", "gecko/", "chrome/", "safari/", "firefox/", "edg/", "opera", "trident/");

    private final List<String> botKeywords;

    public KeywordUserAgentClassifier() {
        this(BOT_KEYWORDS);
    }

    public KeywordUserAgentClassifier(List<String> botKeywords) {
        this.botKeywords = botKeywords.stream().map(k -> k.toLowerCase(Locale.ROOT)).toList();
    }

    @Override
    public UserAgentClass classify(String userAgent) {
        if (userAgent == null || userAgent.isBlank() || "-".equals(userAgent.trim())) {
            return UserAgentClass.UNKNOWN;
        }
        String ua = userAgent.toLowerCase(Locale.ROOT);
        for (String keyword : botKeywords) {
            if (ua.contains(keyword)) {
                return UserAgentClass.BOT;
            }
        }
        for (String keyword : BROWSER_KEYWORDS) {
            if (ua.contains(keyword)) {
                return UserAgentClass.BROWSER;
            }
        }
        return UserAgentClass.UNKNOWN;
    }
}
