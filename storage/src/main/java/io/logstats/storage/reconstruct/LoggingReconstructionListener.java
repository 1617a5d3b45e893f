// file: src/main/java/io/logstats/storage/reconstruct/LoggingReconstructionListener.java
package io.logstats.storage.reconstruct;

import java.nio.charset.StandardCharsets;
import java.util.logging.Logger;

final class LoggingReconstructionListener implements ReconstructionListener {
    private static final Logger log = Logger.getLogger(ReconstructionPipeline.class.getName());

    @Override
    public void onProgress(long linesWritten) {
        log.info(() -> linesWritten + " stat lines parsed");
    }

    @Override
    public void onMalformedLine(byte[] line, String reason) {
        log.warning(() -> "Passing through unreconstructable line (" + reason + "): "
                + new String(line, StandardCharsets.UTF_8));
    }

    @Override
    public void onFinished(ReconstructionResult result) {
        log.info(() -> "Total lines parsed - " + result.linesWritten() + " " + result);
    }
}
