package github.sarthakdev143.slideshow_factory.model;

public enum BuildStage {
    VALIDATING("Validating"),
    FETCHING("Fetching"),
    ASSEMBLING("Assembling"),
    ENCODING("Encoding"),
    UPLOADING("Uploading"),
    NOTIFYING("Notifying");

    private final String label;

    BuildStage(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }
}
