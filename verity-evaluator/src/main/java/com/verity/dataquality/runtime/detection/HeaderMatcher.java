package com.verity.dataquality.runtime.detection;

import com.verity.dataquality.api.model.HeaderMatchResult;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Case-sensitive comparison of expected against actual column names.
 * Output lists keep the order of their input; names differing only in case
 * are paired up as hints.
 */
public final class HeaderMatcher {

    public HeaderMatchResult match(List<String> expected, List<String> actual) {
        Set<String> expectedSet = new LinkedHashSet<>(expected == null ? List.of() : expected);
        Set<String> actualSet = new LinkedHashSet<>(actual == null ? List.of() : actual);

        List<String> matched = new ArrayList<>();
        List<String> missing = new ArrayList<>();
        for (String name : expectedSet) {
            if (actualSet.contains(name)) {
                matched.add(name);
            } else {
                missing.add(name);
            }
        }

        List<String> unexpected = new ArrayList<>();
        for (String name : actualSet) {
            if (!expectedSet.contains(name)) {
                unexpected.add(name);
            }
        }

        List<HeaderMatchResult.CaseMismatch> caseMismatches = new ArrayList<>();
        for (String wanted : missing) {
            for (String present : unexpected) {
                if (wanted.equalsIgnoreCase(present)) {
                    caseMismatches.add(new HeaderMatchResult.CaseMismatch(wanted, present));
                    break;
                }
            }
        }

        return new HeaderMatchResult(List.copyOf(expectedSet), List.copyOf(actualSet),
            matched, missing, unexpected, caseMismatches);
    }
}
