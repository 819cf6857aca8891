package com.phillippitts.djvuocr.config.properties;

import com.phillippitts.djvuocr.domain.ErrorPolicy;
import com.phillippitts.djvuocr.domain.RenderLayers;
import com.phillippitts.djvuocr.domain.TextDetails;
import com.phillippitts.djvuocr.service.engine.EngineType;
import com.phillippitts.djvuocr.service.save.SaverType;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Options of a document run, bound from {@code ocr.*} properties and command-line arguments.
 *
 * <p>Example:
 * <pre>
 * java -jar djvu-ocr.jar --ocr.output=bundled --ocr.output-path=out.djvu \
 *     --ocr.language=deu --ocr.pages=1-10 --ocr.jobs=4 book.djvu
 * </pre>
 *
 * <p>Cross-field rules (an output path for savers that need one, an existing raw OCR
 * directory, parsable pages and filename template) are checked by
 * {@link com.phillippitts.djvuocr.config.OcrOptionsValidator}.
 */
@ConfigurationProperties(prefix = "ocr")
@Validated
public class OcrProperties {

    @NotNull(message = "OCR engine must be set")
    private EngineType engine = EngineType.TESSERACT;

    /** Recognition language; engine default when unset. Combinations like {@code eng+deu} are allowed. */
    private String language;

    /** Page selection such as {@code 1,5-9}; all pages when unset. */
    private String pages;

    @Positive(message = "Number of jobs must be positive")
    private int jobs = Runtime.getRuntime().availableProcessors();

    @NotNull(message = "Text details must be set")
    private TextDetails details = TextDetails.LINES;

    @NotNull(message = "Render layers must be set")
    private RenderLayers render = RenderLayers.MASK;

    @NotNull(message = "Error policy must be set")
    private ErrorPolicy onError = ErrorPolicy.ABORT;

    /** Remove existing hidden text before adding new text. */
    private boolean clearText;

    /** Keep only pages that received OCR text (bundled and indirect output). */
    private boolean ocrOnly;

    /** Keep the working directory and save raw engine output into it. */
    private boolean debug;

    private String saveRawOcrDir;

    @NotBlank(message = "Raw OCR filename template must not be blank")
    private String rawOcrFilenameTemplate = "{id-ext}";

    private SaverType output;

    private String outputPath;

    /** Engine specific settings, for example {@code ocr.engine-properties.psm=6}. */
    private Map<String, String> engineProperties = new LinkedHashMap<>();

    private boolean listEngines;

    private boolean listLanguages;

    public EngineType getEngine() {
        return engine;
    }

    public void setEngine(EngineType engine) {
        this.engine = engine;
    }

    public String getLanguage() {
        return language;
    }

    public void setLanguage(String language) {
        this.language = language;
    }

    public String getPages() {
        return pages;
    }

    public void setPages(String pages) {
        this.pages = pages;
    }

    public int getJobs() {
        return jobs;
    }

    public void setJobs(int jobs) {
        this.jobs = jobs;
    }

    public TextDetails getDetails() {
        return details;
    }

    public void setDetails(TextDetails details) {
        this.details = details;
    }

    public RenderLayers getRender() {
        return render;
    }

    public void setRender(RenderLayers render) {
        this.render = render;
    }

    public ErrorPolicy getOnError() {
        return onError;
    }

    public void setOnError(ErrorPolicy onError) {
        this.onError = onError;
    }

    public boolean isClearText() {
        return clearText;
    }

    public void setClearText(boolean clearText) {
        this.clearText = clearText;
    }

    public boolean isOcrOnly() {
        return ocrOnly;
    }

    public void setOcrOnly(boolean ocrOnly) {
        this.ocrOnly = ocrOnly;
    }

    public boolean isDebug() {
        return debug;
    }

    public void setDebug(boolean debug) {
        this.debug = debug;
    }

    public String getSaveRawOcrDir() {
        return saveRawOcrDir;
    }

    public void setSaveRawOcrDir(String saveRawOcrDir) {
        this.saveRawOcrDir = saveRawOcrDir;
    }

    public String getRawOcrFilenameTemplate() {
        return rawOcrFilenameTemplate;
    }

    public void setRawOcrFilenameTemplate(String rawOcrFilenameTemplate) {
        this.rawOcrFilenameTemplate = rawOcrFilenameTemplate;
    }

    public SaverType getOutput() {
        return output;
    }

    public void setOutput(SaverType output) {
        this.output = output;
    }

    public String getOutputPath() {
        return outputPath;
    }

    public void setOutputPath(String outputPath) {
        this.outputPath = outputPath;
    }

    public Map<String, String> getEngineProperties() {
        return engineProperties;
    }

    public void setEngineProperties(Map<String, String> engineProperties) {
        this.engineProperties = engineProperties;
    }

    public boolean isListEngines() {
        return listEngines;
    }

    public void setListEngines(boolean listEngines) {
        this.listEngines = listEngines;
    }

    public boolean isListLanguages() {
        return listLanguages;
    }

    public void setListLanguages(boolean listLanguages) {
        this.listLanguages = listLanguages;
    }
}
