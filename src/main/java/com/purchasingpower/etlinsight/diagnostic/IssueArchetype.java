package com.purchasingpower.etlinsight.diagnostic;

import java.util.List;

/**
 * Named, reusable diagnostic pattern such as "empty table".
 *
 * @param name           lower-case pattern name, also matched as a keyword
 * @param description    one-line summary
 * @param triggerKeywords extra lower-case keywords that select this archetype
 * @param commonCauses   typical causes, also matched as keywords
 * @param debuggingSteps what to check, in order
 * @param solutions      fixes offered as recommendations
 * @since 1.0.0
 */
public record IssueArchetype(
    String name,
    String description,
    List<String> triggerKeywords,
    List<String> commonCauses,
    List<String> debuggingSteps,
    List<String> solutions
) {

    public IssueArchetype {
        triggerKeywords = List.copyOf(triggerKeywords);
        commonCauses = List.copyOf(commonCauses);
        debuggingSteps = List.copyOf(debuggingSteps);
        solutions = List.copyOf(solutions);
    }
}
