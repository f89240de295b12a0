package com.deepsearch.research.service.search;

import com.deepsearch.research.config.DeepSearchProperties;
import com.deepsearch.research.util.UrlNormalizer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Locale;
import java.util.function.Predicate;
import java.util.regex.Pattern;

/**
 * URL 수집 허용 여부를 판단합니다.
 *
 * Patterns containing {@code *} are globs matched from the start of the host
 * ({@code 192.168.*}); other patterns match as a substring of the host.
 * Blocked patterns are checked first. An allow-list containing {@code *} admits every host.
 */
@Component
@Slf4j
public class DomainPolicy {

    private static final String WILDCARD = "*";

    private final List<Predicate<String>> blocked;
    private final List<Predicate<String>> allowed;
    private final boolean allowAll;

    public DomainPolicy(DeepSearchProperties properties) {
        DeepSearchProperties.Security security = properties.getSecurity();
        this.blocked = security.getBlockedDomains().stream().map(DomainPolicy::toMatcher).toList();
        this.allowed = security.getAllowedDomains().stream().map(DomainPolicy::toMatcher).toList();
        this.allowAll = security.getAllowedDomains().contains(WILDCARD);
        log.info("Domain policy loaded: {} blocked patterns, allow-list {}",
                blocked.size(), allowAll ? "unrestricted" : security.getAllowedDomains());
    }

    public boolean isAllowed(String url) {
        String domain = UrlNormalizer.extractDomain(url);
        if (domain == null) {
            return false;
        }

        for (Predicate<String> matcher : blocked) {
            if (matcher.test(domain)) {
                log.debug("Blocked domain: {}", domain);
                return false;
            }
        }

        if (allowAll) {
            return true;
        }
        return allowed.stream().anyMatch(matcher -> matcher.test(domain));
    }

    private static Predicate<String> toMatcher(String pattern) {
        String normalized = pattern.trim().toLowerCase(Locale.ROOT);
        if (!normalized.contains(WILDCARD)) {
            return domain -> domain.contains(normalized);
        }

        String[] parts = normalized.split("\\*", -1);
        StringBuilder regex = new StringBuilder("^");
        for (int i = 0; i < parts.length; i++) {
            if (i > 0) regex.append(".*");
            regex.append(Pattern.quote(parts[i]));
        }
        Pattern compiled = Pattern.compile(regex.toString());
        return domain -> compiled.matcher(domain).find();
    }
}
