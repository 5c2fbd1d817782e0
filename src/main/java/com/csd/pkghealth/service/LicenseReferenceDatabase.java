package com.csd.pkghealth.service;

import com.csd.pkghealth.model.BlueOakRating;
import com.csd.pkghealth.model.LicenseFamily;
import com.csd.pkghealth.model.LicenseInfo;
import org.springframework.stereotype.Component;

import java.util.Collections;
import java.util.HashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Reference data for the SPDX licenses commonly found in the npm ecosystem: legal family,
 * Blue Oak Council rating, patent grant and OSI approval. Lookups ignore case.
 */
@Component
public class LicenseReferenceDatabase {

    private static final Set<String> PERMISSIVE = Set.of(
            "MIT", "MIT-0", "MIT-Modern-Variant", "ISC", "0BSD",
            "BSD-2-Clause", "BSD-2-Clause-Patent", "BSD-3-Clause", "BSD-3-Clause-Clear", "BSD-4-Clause",
            "Apache-1.1", "Apache-2.0", "Unlicense", "CC0-1.0", "Zlib", "BSL-1.0", "PostgreSQL", "X11",
            "Artistic-1.0", "Artistic-1.0-Perl", "Artistic-1.0-cl8", "Artistic-2.0",
            "WTFPL", "Beerware", "JSON", "FTL", "IJG", "Libpng", "libtiff", "NTP", "OpenSSL",
            "PHP-3.0", "PHP-3.01", "Python-2.0", "Ruby", "SGI-B-2.0", "Spencer-86", "Spencer-94",
            "Unicode-DFS-2016", "Unicode-TOU", "Vim", "W3C", "Xnet", "BlueOak-1.0.0",
            "CC-BY-1.0", "CC-BY-2.0", "CC-BY-2.5", "CC-BY-3.0", "CC-BY-4.0",
            "AFL-1.1", "AFL-1.2", "AFL-2.0", "AFL-2.1", "AFL-3.0",
            "OSL-1.0", "OSL-1.1", "OSL-2.0", "OSL-2.1", "OSL-3.0",
            "UPL-1.0", "NCSA", "ECL-1.0", "ECL-2.0", "EFL-1.0", "EFL-2.0", "Fair", "MS-PL",
            "Abstyles", "AdaCore-doc", "Entessa", "HPND", "HPND-sell-variant", "OFL-1.1");

    private static final Set<String> WEAK_COPYLEFT = Set.of(
            "LGPL-2.0", "LGPL-2.0-only", "LGPL-2.0-or-later",
            "LGPL-2.1", "LGPL-2.1-only", "LGPL-2.1-or-later",
            "LGPL-3.0", "LGPL-3.0-only", "LGPL-3.0-or-later",
            "MPL-1.0", "MPL-1.1", "MPL-2.0", "MPL-2.0-no-copyleft-exception",
            "EPL-1.0", "EPL-2.0", "CDDL-1.0", "CDDL-1.1", "CPL-1.0",
            "EUPL-1.0", "EUPL-1.1", "EUPL-1.2", "MS-RL", "APSL-1.0", "APSL-2.0",
            "Nokia", "RPSL-1.0", "RSCPL", "SPL-1.0", "Watcom-1.0", "wxWindows",
            "LPL-1.0", "LPL-1.02", "QPL-1.0", "Sleepycat", "IPL-1.0", "CATOSL-1.1", "APL-1.0");

    private static final Set<String> STRONG_COPYLEFT = Set.of(
            "GPL-1.0", "GPL-1.0-only", "GPL-1.0-or-later",
            "GPL-2.0", "GPL-2.0-only", "GPL-2.0-or-later",
            "GPL-3.0", "GPL-3.0-only", "GPL-3.0-or-later",
            "CC-BY-SA-1.0", "CC-BY-SA-2.0", "CC-BY-SA-2.5", "CC-BY-SA-3.0", "CC-BY-SA-4.0",
            "CC-BY-NC-1.0", "CC-BY-NC-2.0", "CC-BY-NC-2.5", "CC-BY-NC-3.0", "CC-BY-NC-4.0",
            "CC-BY-NC-SA-1.0", "CC-BY-NC-SA-2.0", "CC-BY-NC-SA-2.5", "CC-BY-NC-SA-3.0", "CC-BY-NC-SA-4.0",
            "CC-BY-NC-ND-1.0", "CC-BY-NC-ND-2.0", "CC-BY-NC-ND-2.5", "CC-BY-NC-ND-3.0", "CC-BY-NC-ND-4.0",
            "GFDL-1.1", "GFDL-1.1-only", "GFDL-1.1-or-later",
            "GFDL-1.2", "GFDL-1.2-only", "GFDL-1.2-or-later",
            "GFDL-1.3", "GFDL-1.3-only", "GFDL-1.3-or-later",
            "ODbL-1.0", "OPL-1.0", "SimPL-2.0");

    private static final Set<String> NETWORK_COPYLEFT = Set.of(
            "AGPL-1.0", "AGPL-1.0-only", "AGPL-1.0-or-later",
            "AGPL-3.0", "AGPL-3.0-only", "AGPL-3.0-or-later", "SSPL-1.0");

    private static final Set<String> GOLD = Set.of(
            "MIT", "MIT-0", "Apache-2.0", "Apache-1.1", "BSD-2-Clause", "BSD-2-Clause-Patent",
            "BlueOak-1.0.0", "CC0-1.0", "Unlicense", "0BSD", "UPL-1.0", "NCSA", "FTL", "Fair");

    private static final Set<String> SILVER = Set.of(
            "BSD-3-Clause", "BSD-3-Clause-Clear", "ISC", "PostgreSQL", "Zlib", "X11", "Python-2.0",
            "Ruby", "PHP-3.0", "PHP-3.01", "ECL-2.0", "EFL-2.0", "Vim", "W3C", "Unicode-DFS-2016",
            "NTP", "OpenSSL", "MS-PL");

    private static final Set<String> BRONZE = Set.of(
            "Artistic-2.0", "LGPL-2.1", "LGPL-2.1-only", "LGPL-2.1-or-later",
            "LGPL-3.0", "LGPL-3.0-only", "LGPL-3.0-or-later", "MPL-2.0", "MPL-1.1",
            "EPL-1.0", "EPL-2.0", "CDDL-1.0", "CDDL-1.1", "EUPL-1.1", "EUPL-1.2",
            "AFL-3.0", "OSL-3.0", "APSL-2.0", "CPL-1.0", "MS-RL");

    private static final Set<String> LEAD = Set.of(
            "JSON", "WTFPL", "Beerware", "CC-BY-3.0", "CC-BY-4.0", "BSL-1.0", "QPL-1.0",
            "Artistic-1.0", "Artistic-1.0-Perl", "Artistic-1.0-cl8", "BSD-4-Clause", "OFL-1.1", "OPL-1.0");

    private static final Set<String> PATENT_CLAUSE = Set.of(
            "Apache-1.1", "Apache-2.0", "AFL-1.1", "AFL-1.2", "AFL-2.0", "AFL-2.1", "AFL-3.0",
            "APL-1.0", "APSL-1.0", "APSL-2.0", "CATOSL-1.1", "CDDL-1.0", "CDDL-1.1", "CPL-1.0",
            "EPL-1.0", "EPL-2.0", "EUPL-1.0", "EUPL-1.1", "EUPL-1.2",
            "GPL-3.0", "GPL-3.0-only", "GPL-3.0-or-later",
            "LGPL-3.0", "LGPL-3.0-only", "LGPL-3.0-or-later",
            "AGPL-3.0", "AGPL-3.0-only", "AGPL-3.0-or-later",
            "IPL-1.0", "MPL-2.0", "MPL-2.0-no-copyleft-exception", "MS-PL", "OSL-3.0", "PHP-3.01",
            "SPL-1.0", "BSD-2-Clause-Patent", "UPL-1.0");

    private static final Set<String> NOT_OSI_APPROVED = Set.of(
            "WTFPL", "Beerware", "JSON", "CC0-1.0", "Unlicense", "BSD-4-Clause", "BSD-3-Clause-Clear",
            "CC-BY-1.0", "CC-BY-2.0", "CC-BY-2.5", "CC-BY-3.0", "CC-BY-4.0", "Libpng", "libtiff",
            "IJG", "FTL", "X11", "SGI-B-2.0", "Spencer-86", "Spencer-94", "Unicode-TOU", "Xnet",
            "Abstyles", "AdaCore-doc", "HPND-sell-variant", "SSPL-1.0", "OPL-1.0", "ODbL-1.0",
            "MIT-Modern-Variant", "Vim", "W3C", "Ruby", "BlueOak-1.0.0", "QPL-1.0", "OFL-1.1",
            "MPL-2.0-no-copyleft-exception", "Artistic-1.0-Perl", "Artistic-1.0-cl8", "Sleepycat",
            "GFDL-1.1", "GFDL-1.1-only", "GFDL-1.1-or-later", "GFDL-1.2", "GFDL-1.2-only",
            "GFDL-1.2-or-later", "GFDL-1.3", "GFDL-1.3-only", "GFDL-1.3-or-later");

    // Bare GNU identifiers were superseded by the -only / -or-later forms
    private static final Set<String> DEPRECATED_IDS = Set.of(
            "GPL-1.0", "GPL-2.0", "GPL-3.0", "LGPL-2.0", "LGPL-2.1", "LGPL-3.0",
            "AGPL-1.0", "AGPL-3.0", "GFDL-1.1", "GFDL-1.2", "GFDL-1.3");

    private static final Map<String, String> ALIASES = Map.ofEntries(
            Map.entry("MIT License", "MIT"),
            Map.entry("The MIT License", "MIT"),
            Map.entry("Apache License 2.0", "Apache-2.0"),
            Map.entry("Apache License, Version 2.0", "Apache-2.0"),
            Map.entry("Apache-2", "Apache-2.0"),
            Map.entry("Apache 2.0", "Apache-2.0"),
            Map.entry("Apache 2", "Apache-2.0"),
            Map.entry("BSD", "BSD-3-Clause"),
            Map.entry("BSD License", "BSD-3-Clause"),
            Map.entry("BSD-3", "BSD-3-Clause"),
            Map.entry("BSD-2", "BSD-2-Clause"),
            Map.entry("3-Clause BSD", "BSD-3-Clause"),
            Map.entry("2-Clause BSD", "BSD-2-Clause"),
            Map.entry("ISC License", "ISC"),
            Map.entry("GPL-1.0", "GPL-1.0-only"),
            Map.entry("GPL-2.0", "GPL-2.0-only"),
            Map.entry("GPL-3.0", "GPL-3.0-only"),
            Map.entry("GPL-3", "GPL-3.0-only"),
            Map.entry("GPL-2", "GPL-2.0-only"),
            Map.entry("GPL-1", "GPL-1.0-only"),
            Map.entry("GPLv3", "GPL-3.0-only"),
            Map.entry("GPLv2", "GPL-2.0-only"),
            Map.entry("GPLv1", "GPL-1.0-only"),
            Map.entry("GNU GPL v3", "GPL-3.0-only"),
            Map.entry("GNU GPL v2", "GPL-2.0-only"),
            Map.entry("GNU GPL v1", "GPL-1.0-only"),
            Map.entry("LGPL-2.0", "LGPL-2.0-only"),
            Map.entry("LGPL-2.1", "LGPL-2.1-only"),
            Map.entry("LGPL-3.0", "LGPL-3.0-only"),
            Map.entry("LGPL-3", "LGPL-3.0-only"),
            Map.entry("LGPL-2", "LGPL-2.0-only"),
            Map.entry("LGPLv3", "LGPL-3.0-only"),
            Map.entry("LGPLv2.1", "LGPL-2.1-only"),
            Map.entry("LGPLv2", "LGPL-2.0-only"),
            Map.entry("AGPL-1.0", "AGPL-1.0-only"),
            Map.entry("AGPL-3.0", "AGPL-3.0-only"),
            Map.entry("AGPL-3", "AGPL-3.0-only"),
            Map.entry("AGPL-1", "AGPL-1.0-only"),
            Map.entry("AGPLv3", "AGPL-3.0-only"),
            Map.entry("AGPLv1", "AGPL-1.0-only"),
            Map.entry("MPL-2", "MPL-2.0"),
            Map.entry("MPL 2.0", "MPL-2.0"),
            Map.entry("CC0", "CC0-1.0"),
            Map.entry("Public Domain", "Unlicense"),
            Map.entry("Unlicensed", "UNLICENSED"));

    private final Map<String, LicenseInfo> licenses;
    private final Map<String, String> aliases;

    public LicenseReferenceDatabase() {
        Map<String, LicenseInfo> byId = new HashMap<>();
        register(byId, PERMISSIVE, LicenseFamily.PERMISSIVE);
        register(byId, WEAK_COPYLEFT, LicenseFamily.WEAK_COPYLEFT);
        register(byId, STRONG_COPYLEFT, LicenseFamily.STRONG_COPYLEFT);
        register(byId, NETWORK_COPYLEFT, LicenseFamily.NETWORK_COPYLEFT);
        this.licenses = Collections.unmodifiableMap(byId);

        Map<String, String> aliasIndex = new HashMap<>();
        ALIASES.forEach((alias, id) -> aliasIndex.put(key(alias), id));
        this.aliases = Collections.unmodifiableMap(aliasIndex);
    }

    public Optional<LicenseInfo> lookup(String spdxId) {
        if (spdxId == null || spdxId.isBlank()) {
            return Optional.empty();
        }
        return Optional.ofNullable(licenses.get(key(spdxId)));
    }

    /**
     * Maps common spellings (e.g. {@code "Apache 2.0"}, {@code "GPLv2"}) to their SPDX id.
     * Unrecognized values are returned trimmed but otherwise unchanged.
     */
    public String normalize(String license) {
        if (license == null) {
            return null;
        }
        String trimmed = license.trim();
        return aliases.getOrDefault(key(trimmed), trimmed);
    }

    public BlueOakRating ratingOf(String spdxId) {
        return lookup(spdxId).map(LicenseInfo::getRating).orElse(BlueOakRating.UNRATED);
    }

    public boolean hasPatentClause(String spdxId) {
        return lookup(spdxId).map(LicenseInfo::isPatentClause).orElse(false);
    }

    public int size() {
        return licenses.size();
    }

    private static void register(Map<String, LicenseInfo> byId, Set<String> ids, LicenseFamily family) {
        for (String id : ids) {
            byId.put(key(id), LicenseInfo.builder()
                    .id(id)
                    .name(id)
                    .family(family)
                    .rating(rating(id))
                    .patentClause(PATENT_CLAUSE.contains(id))
                    .osiApproved(!NOT_OSI_APPROVED.contains(id) && !id.startsWith("CC-"))
                    .deprecated(DEPRECATED_IDS.contains(id))
                    .build());
        }
    }

    private static BlueOakRating rating(String id) {
        if (GOLD.contains(id)) return BlueOakRating.GOLD;
        if (SILVER.contains(id)) return BlueOakRating.SILVER;
        if (BRONZE.contains(id)) return BlueOakRating.BRONZE;
        if (LEAD.contains(id)) return BlueOakRating.LEAD;
        return BlueOakRating.UNRATED;
    }

    private static String key(String value) {
        return value.trim().toUpperCase(Locale.ROOT);
    }
}
