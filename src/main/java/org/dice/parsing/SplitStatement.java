package org.dice.parsing;

import org.apache.commons.lang.StringUtils;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Premise and conclusion texts of one statement, before parsing.
 */
public class SplitStatement {

    private final List<String> premises;
    private final String conclusion;

    public SplitStatement(List<String> premises, String conclusion) {
        this.premises = Collections.unmodifiableList(new ArrayList<String>(premises));
        this.conclusion = conclusion;
    }

    public List<String> getPremises() {
        return premises;
    }

    /**
     * @return the conclusion text, or null when the statement has no conclusion separator
     */
    public String getConclusion() {
        return conclusion;
    }

    public boolean hasConclusion() {
        return conclusion != null;
    }

    @Override
    public String toString(){
        String joined = StringUtils.join(premises, ", ");
        return hasConclusion() ? String.format("%s therefore %s", joined, conclusion) : joined;
    }
}
