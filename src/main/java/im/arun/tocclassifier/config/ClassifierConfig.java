package im.arun.tocclassifier.config;

import lombok.Data;

@Data
public class ClassifierConfig {
    private int shortDocumentMaxPages = 3;
    private int frontMatterDivisor = 3;
    private int romanMinRunLength = 3;
    private String outputFormat = "text";
}
