package com.csd.pkghealth.service;

import com.csd.pkghealth.config.AnalyzerProperties;
import com.csd.pkghealth.model.PackageMetadata;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Decides whether a package is excluded from scoring. Rules are checked in order:
 * exact name, scope pattern, prefix pattern, then author or maintainer.
 */
@Component
public class IgnoreMatcher {

    /**
     * @param metadata may be null, in which case author rules are not evaluated
     * @return the reason the package is ignored, or empty when it is not
     */
    public Optional<String> ignoreReason(String name, PackageMetadata metadata, AnalyzerProperties.Ignore rules) {
        if (rules == null) {
            return Optional.empty();
        }
        if (rules.getPackages().contains(name)) {
            return Optional.of(rules.getReasons().getOrDefault(name, "Explicitly ignored"));
        }
        for (String scope : rules.getScopes()) {
            if (matches(name, scope)) {
                return Optional.of(rules.getReasons().getOrDefault(scope, "Matches scope: " + scope));
            }
        }
        for (String prefix : rules.getPrefixes()) {
            if (matches(name, prefix)) {
                return Optional.of(rules.getReasons().getOrDefault(prefix, "Matches prefix: " + prefix));
            }
        }
        if (metadata != null && matchesAuthor(metadata, rules.getAuthors())) {
            return Optional.of("Author is in ignore list");
        }
        return Optional.empty();
    }

    public boolean shouldIgnore(String name, PackageMetadata metadata, AnalyzerProperties.Ignore rules) {
        return ignoreReason(name, metadata, rules).isPresent();
    }

    // glob: '*' matches any run of characters, everything else is literal
    static boolean matches(String name, String pattern) {
        if (pattern == null || pattern.isEmpty()) {
            return false;
        }
        String[] parts = pattern.split("\\*", -1);
        StringBuilder regex = new StringBuilder();
        for (int i = 0; i < parts.length; i++) {
            if (i > 0) regex.append(".*");
            if (!parts[i].isEmpty()) regex.append(Pattern.quote(parts[i]));
        }
        return Pattern.matches(regex.toString(), name);
    }

    private static boolean matchesAuthor(PackageMetadata metadata, List<String> authors) {
        if (authors == null || authors.isEmpty()) {
            return false;
        }
        List<String> people = new ArrayList<>();
        if (metadata.getAuthor() != null) {
            people.add(metadata.getAuthor().toLowerCase(Locale.ROOT));
        }
        metadata.getMaintainers().forEach(m -> people.add(m.toLowerCase(Locale.ROOT)));
        return authors.stream()
                .map(a -> a.toLowerCase(Locale.ROOT))
                .anyMatch(ignored -> people.stream().anyMatch(person -> person.contains(ignored)));
    }
}
