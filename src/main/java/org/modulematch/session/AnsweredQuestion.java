package org.modulematch.session;

/**
 * One entry of a session's answer history.
 */
public class AnsweredQuestion {
    private final String label;
    private final String phenotypeId;
    private final Answer answer;

    public AnsweredQuestion(String label, String phenotypeId, Answer answer) {
        this.label = label;
        this.phenotypeId = phenotypeId;
        this.answer = answer;
    }

    public String getLabel() {
        return label;
    }

    public String getPhenotypeId() {
        return phenotypeId;
    }

    public Answer getAnswer() {
        return answer;
    }

    @Override
    public String toString() {
        return label + " (" + phenotypeId + "): " + answer;
    }
}
