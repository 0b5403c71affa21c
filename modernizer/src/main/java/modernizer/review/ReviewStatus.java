package modernizer.review;

public enum ReviewStatus {
    ACCEPTED,
    MANUAL;

    public String label() {
        return name().toLowerCase();
    }
}
