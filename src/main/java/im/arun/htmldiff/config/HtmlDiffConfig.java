package im.arun.htmldiff.config;

import im.arun.htmldiff.diff.Granularity;
import lombok.Data;

@Data
public class HtmlDiffConfig {
    private Granularity granularity = Granularity.WORD;
    private boolean containerFallback = true;
    private boolean documentTextFallback = true;
    private boolean indentOutput = true;
    private boolean sessionLog = false;
    private String logDirectory = "./logs";
}
