package com.verity.dataquality.api;

import com.verity.dataquality.api.model.RuleSet;

import java.nio.file.Path;

/**
 * Contract for turning a rule definition file into an immutable rule set.
 */
public interface IRuleSetLoader {

    /**
     * Loads rules from a definition file.
     *
     * @param rulesPath path to a CSV/delimited or JSON rule definition
     * @return the loaded rules, never empty
     * @throws com.verity.dataquality.api.exceptions.RuleSetLoadException if the file
     *         cannot be read or yields no rules
     */
    RuleSet load(Path rulesPath);
}
