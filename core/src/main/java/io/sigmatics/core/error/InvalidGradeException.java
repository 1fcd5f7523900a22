package io.sigmatics.core.error;

/** Thrown when a Clifford grade lies outside {@code 0..7}. */
public final class InvalidGradeException extends ConstructionException {

    private static final long serialVersionUID = 1L;

    public static final String CODE = "InvalidGrade";

    private final int grade;

    public InvalidGradeException(int grade) {
        super("Invalid grade: " + grade + ". Must be 0..7.", null);
        this.grade = grade;
    }

    public int grade() {
        return grade;
    }

    @Override
    public String code() {
        return CODE;
    }
}
