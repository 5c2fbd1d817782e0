package com.csd.pkghealth.service;

import com.csd.pkghealth.model.BlueOakRating;
import com.csd.pkghealth.model.LicenseAnalysis;
import com.csd.pkghealth.model.LicenseCategory;
import com.csd.pkghealth.model.LicenseFamily;
import com.csd.pkghealth.model.LicenseInfo;
import com.csd.pkghealth.model.LicensePolicy;
import com.csd.pkghealth.model.PackageMetadata;
import com.csd.pkghealth.model.ProjectType;
import com.csd.pkghealth.model.Severity;
import lombok.Value;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.Arrays;
import java.util.Comparator;
import java.util.List;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Classifies a package's declared license against the reference database and the scan's
 * license policy.
 */
@Service
@Slf4j
public class LicenseAnalyzer {

    private static final Comparator<Verdict> BY_PERMISSIVENESS = Comparator
            .comparingInt((Verdict v) -> permissiveness(v.getFamily()))
            .thenComparing(Verdict::getSeverity, Comparator.reverseOrder());

    private final LicenseReferenceDatabase database;

    public LicenseAnalyzer(LicenseReferenceDatabase database) {
        this.database = database;
    }

    public LicenseAnalysis analyzeLicense(PackageMetadata metadata, ProjectType projectType, LicensePolicy policy) {
        String declared = metadata.getLicense();
        if (declared == null || declared.isBlank()) {
            return unlicensed(metadata, "UNLICENSED", "No license specified");
        }
        if ("UNLICENSED".equalsIgnoreCase(database.normalize(declared))) {
            return unlicensed(metadata, "UNLICENSED", "Package is explicitly marked as unlicensed");
        }

        // operands are normalized one by one so policy patterns see the declared spelling too
        LicenseExpression expression = LicenseExpression.parse(declared);
        Verdict verdict = evaluate(expression, projectType, policy);

        boolean commercialUse = verdict.getCategory() == LicenseCategory.COMMERCIAL_FRIENDLY
                || (verdict.getCategory() == LicenseCategory.COMMERCIAL_WARNING && projectType.isCopyleftTolerant());
        boolean patentClause = policy.isCheckPatentClauses()
                && verdict.getInfo() != null && verdict.getInfo().isPatentClause();

        return LicenseAnalysis.builder()
                .packageName(metadata.getName())
                .version(metadata.getVersion())
                .license(expression.getExpression())
                .spdxId(verdict.getSpdxId())
                .category(verdict.getCategory())
                .blueOakRating(verdict.getInfo() != null ? verdict.getInfo().getRating() : BlueOakRating.UNRATED)
                .severity(verdict.getSeverity())
                .dualLicense(expression.isDual())
                .patentClause(patentClause)
                .commercialUse(commercialUse)
                .reason(verdict.getReason())
                .build();
    }

    /**
     * License dimension of the health score, in [0, 1].
     */
    public static double licenseScore(LicenseCategory category, BlueOakRating rating, boolean patentClause,
                                      ProjectType projectType) {
        if (category == null || category == LicenseCategory.UNLICENSED) {
            return 0.0;
        }
        boolean tolerant = projectType != null && projectType.isCopyleftTolerant();
        double score;
        switch (category) {
            case COMMERCIAL_FRIENDLY:
                score = 1.0;
                break;
            case COMMERCIAL_WARNING:
                score = tolerant ? 0.8 : 0.5;
                break;
            case COMMERCIAL_INCOMPATIBLE:
                score = tolerant ? 0.6 : 0.0;
                break;
            default:
                score = 0.3;
        }
        if (rating != null && rating.isLegallySound()) {
            score *= 1.1;
        } else if (rating == BlueOakRating.LEAD) {
            score *= 0.8;
        }
        if (patentClause) {
            score *= 1.05;
        }
        return Math.max(0.0, Math.min(1.0, score));
    }

    private Verdict evaluate(LicenseExpression expression, ProjectType projectType, LicensePolicy policy) {
        if (expression.isSingle()) {
            return classify(expression.getExpression(), projectType, policy);
        }
        List<Verdict> verdicts = expression.getOperands().stream()
                .map(operand -> evaluate(LicenseExpression.parse(operand), projectType, policy))
                .collect(Collectors.toList());
        // a dual license lets the user pick the best option, a conjunction binds them to all
        return expression.isDual()
                ? verdicts.stream().max(BY_PERMISSIVENESS).orElseThrow()
                : verdicts.stream().min(BY_PERMISSIVENESS).orElseThrow();
    }

    private Verdict classify(String operand, ProjectType projectType, LicensePolicy policy) {
        String spdxId = database.normalize(operand);
        LicenseInfo info = database.lookup(spdxId).orElse(null);
        LicenseFamily family = info != null ? info.getFamily() : null;
        LicenseCategory category = family != null ? family.getCategory() : LicenseCategory.UNKNOWN;
        String canonicalId = info != null ? info.getId() : spdxId;

        if (matchesAny(policy.getDeny(), canonicalId, operand)) {
            return new Verdict(canonicalId, info, family, LicenseCategory.COMMERCIAL_INCOMPATIBLE,
                    Severity.CRITICAL, "Explicitly denied by license policy");
        }
        if (matchesAny(policy.getAllow(), canonicalId, operand)) {
            LicenseCategory allowed = category == LicenseCategory.UNKNOWN ? LicenseCategory.COMMERCIAL_FRIENDLY : category;
            return new Verdict(canonicalId, info, family, allowed, Severity.OK, "Explicitly allowed by license policy");
        }

        Severity severity = familySeverity(family, projectType, policy);
        String reason = familyReason(canonicalId, family, projectType);
        if (matchesAny(policy.getWarn(), canonicalId, operand)) {
            severity = Severity.worst(severity, Severity.WARNING);
            reason = reason + "; listed for review by license policy";
        }
        return new Verdict(canonicalId, info, family, category, severity, reason);
    }

    private static Severity familySeverity(LicenseFamily family, ProjectType projectType, LicensePolicy policy) {
        if (family == null) {
            return policy.isWarnOnUnknown() ? Severity.WARNING : Severity.OK;
        }
        if (family == LicenseFamily.NETWORK_COPYLEFT && projectType == ProjectType.SAAS) {
            return Severity.CRITICAL;
        }
        if (family.isCopyleft() && projectType.isCopyleftTolerant()) {
            return Severity.OK;
        }
        switch (family) {
            case PERMISSIVE:
                return Severity.OK;
            case WEAK_COPYLEFT:
                return Severity.WARNING;
            default:
                return Severity.CRITICAL;
        }
    }

    private static String familyReason(String spdxId, LicenseFamily family, ProjectType projectType) {
        if (family == null) {
            return "License \"" + spdxId + "\" is not in the license database; review it manually "
                    + "or add it to the allow/deny list";
        }
        if (family == LicenseFamily.NETWORK_COPYLEFT && projectType == ProjectType.SAAS) {
            return "Network copyleft requires source disclosure for network services";
        }
        switch (family) {
            case PERMISSIVE:
                return "Permissive license";
            case WEAK_COPYLEFT:
                return projectType.isCopyleftTolerant()
                        ? "Weak copyleft acceptable for " + projectType.getValue() + " projects"
                        : "Weak copyleft license, review required";
            default:
                return projectType.isCopyleftTolerant()
                        ? "Copyleft license acceptable for " + projectType.getValue() + " projects"
                        : "Strong copyleft license incompatible with commercial use";
        }
    }

    static boolean matchesAny(List<String> patterns, String... candidates) {
        if (patterns == null || patterns.isEmpty()) {
            return false;
        }
        for (String pattern : patterns) {
            if (pattern == null || pattern.isBlank()) continue;
            Pattern regex = toRegex(pattern);
            for (String candidate : candidates) {
                if (candidate != null && regex.matcher(candidate.trim()).matches()) {
                    return true;
                }
            }
        }
        return false;
    }

    // "GPL-*" -> ^\QGPL-\E.*$ ; only '*' is special
    private static Pattern toRegex(String pattern) {
        String regex = Arrays.stream(pattern.trim().split("\\*", -1))
                .map(part -> part.isEmpty() ? "" : Pattern.quote(part))
                .collect(Collectors.joining(".*"));
        return Pattern.compile(regex, Pattern.CASE_INSENSITIVE);
    }

    private static int permissiveness(LicenseFamily family) {
        if (family == null) {
            return 0;
        }
        return LicenseFamily.values().length - family.ordinal();
    }

    private static LicenseAnalysis unlicensed(PackageMetadata metadata, String license, String reason) {
        log.debug("{}@{} has no usable license: {}", metadata.getName(), metadata.getVersion(), reason);
        return LicenseAnalysis.builder()
                .packageName(metadata.getName())
                .version(metadata.getVersion())
                .license(license)
                .category(LicenseCategory.UNLICENSED)
                .blueOakRating(BlueOakRating.UNRATED)
                .severity(Severity.CRITICAL)
                .dualLicense(false)
                .patentClause(false)
                .commercialUse(false)
                .reason(reason)
                .build();
    }

    @Value
    private static class Verdict {
        String spdxId;
        LicenseInfo info;
        LicenseFamily family;
        LicenseCategory category;
        Severity severity;
        String reason;
    }
}
