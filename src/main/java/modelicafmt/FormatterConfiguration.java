package modelicafmt;

import java.io.IOException;
import java.io.Reader;
import java.nio.charset.Charset;
import java.nio.charset.IllegalCharsetNameException;
import java.nio.charset.StandardCharsets;
import java.nio.charset.UnsupportedCharsetException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Properties;

/**
 * Settings for a formatting run and for the command line driver.
 */
public class FormatterConfiguration {

    static final String KEY_ALWAYS_INDENT_PARENS = "format.alwaysIndentParens";
    static final String KEY_OVERWRITE = "format.overwrite";
    static final String KEY_FILE_EXTENSION = "format.fileExtension";
    static final String KEY_CHARSET = "format.charset";
    static final String KEY_VERBOSE = "logging.verbose";

    private boolean alwaysIndentParens = false;
    private boolean overwrite = false;
    private String fileExtension = "mo";
    private String charsetName = StandardCharsets.UTF_8.name();
    private boolean verboseLogging = false;

    public boolean isAlwaysIndentParens() { return alwaysIndentParens; }
    public void setAlwaysIndentParens(boolean alwaysIndentParens) { this.alwaysIndentParens = alwaysIndentParens; }

    public boolean isOverwrite() { return overwrite; }
    public void setOverwrite(boolean overwrite) { this.overwrite = overwrite; }

    public String getFileExtension() { return fileExtension; }
    public void setFileExtension(String fileExtension) { this.fileExtension = fileExtension; }

    public String getCharsetName() { return charsetName; }
    public void setCharsetName(String charsetName) { this.charsetName = charsetName; }

    public boolean isVerboseLogging() { return verboseLogging; }
    public void setVerboseLogging(boolean verbose) { this.verboseLogging = verbose; }

    /**
     * @throws IllegalArgumentException if the charset name is not supported,
     *         {@link #validate()} reports the same problem without throwing
     */
    public Charset getCharset() {
        return Charset.forName(charsetName);
    }

    // Initialize defaults
    public void loadDefaults() {
        alwaysIndentParens = false;
        overwrite = false;
        fileExtension = "mo";
        charsetName = StandardCharsets.UTF_8.name();
        verboseLogging = false;
    }

    public void load(Path propertiesFile) throws IOException {
        Properties properties = new Properties();
        try (Reader reader = Files.newBufferedReader(propertiesFile, StandardCharsets.UTF_8)) {
            properties.load(reader);
        }
        load(properties);
    }

    /**
     * Applies the keys present in {@code properties}; absent keys keep their
     * current value.
     */
    public void load(Properties properties) {
        String value = properties.getProperty(KEY_ALWAYS_INDENT_PARENS);
        if (value != null) {
            alwaysIndentParens = Boolean.parseBoolean(value.trim());
        }
        value = properties.getProperty(KEY_OVERWRITE);
        if (value != null) {
            overwrite = Boolean.parseBoolean(value.trim());
        }
        value = properties.getProperty(KEY_FILE_EXTENSION);
        if (value != null) {
            fileExtension = value.trim();
        }
        value = properties.getProperty(KEY_CHARSET);
        if (value != null) {
            charsetName = value.trim();
        }
        value = properties.getProperty(KEY_VERBOSE);
        if (value != null) {
            verboseLogging = Boolean.parseBoolean(value.trim());
        }
    }

    public List<String> validate() {
        List<String> issues = new ArrayList<>();

        if (fileExtension == null || fileExtension.isEmpty()) {
            issues.add("File extension must not be empty");
        } else if (fileExtension.startsWith(".")) {
            issues.add("File extension must be given without a leading dot: " + fileExtension);
        }

        if (charsetName == null || charsetName.isEmpty()) {
            issues.add("Charset must not be empty");
        } else {
            try {
                Charset.forName(charsetName);
            } catch (IllegalCharsetNameException | UnsupportedCharsetException e) {
                issues.add("Unsupported charset: " + charsetName);
            }
        }

        return issues;
    }

    @Override
    public String toString() {
        return String.format("FormatterConfiguration{alwaysIndentParens=%s, overwrite=%s, extension=%s, charset=%s, verbose=%s}",
                             alwaysIndentParens, overwrite, fileExtension, charsetName, verboseLogging);
    }
}
