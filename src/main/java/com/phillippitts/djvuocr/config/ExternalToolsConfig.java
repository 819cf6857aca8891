package com.phillippitts.djvuocr.config;

import com.phillippitts.djvuocr.service.process.DefaultProcessFactory;
import com.phillippitts.djvuocr.service.process.ProcessFactory;
import com.phillippitts.djvuocr.service.process.ProcessRunner;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Wiring for launching external tools (tesseract and the DjVuLibre utilities).
 */
@Configuration
public class ExternalToolsConfig {

    @Bean
    public ProcessFactory processFactory() {
        return new DefaultProcessFactory();
    }

    /**
     * One runner is shared by every page worker; it keeps no per-call state.
     */
    @Bean
    public ProcessRunner processRunner(ProcessFactory processFactory) {
        return new ProcessRunner(processFactory);
    }
}
