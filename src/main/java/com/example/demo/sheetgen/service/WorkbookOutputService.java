package com.example.demo.sheetgen.service;

import com.example.demo.sheetgen.exception.ReportWriteException;
import lombok.extern.slf4j.Slf4j;
import org.apache.poi.ss.usermodel.Workbook;
import org.springframework.stereotype.Component;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Serializes workbooks to bytes, streams or files.
 */
@Slf4j
@Component
public class WorkbookOutputService {

    public byte[] toBytes(Workbook workbook) {
        try (ByteArrayOutputStream baos = new ByteArrayOutputStream()) {
            workbook.write(baos);
            return baos.toByteArray();
        } catch (IOException e) {
            throw new ReportWriteException("WORKBOOK_SERIALIZATION_FAILED", "Failed to serialize workbook", e);
        }
    }

    /**
     * Writes the workbook to the stream without closing it.
     */
    public void writeTo(Workbook workbook, OutputStream out) {
        try {
            workbook.write(out);
            out.flush();
        } catch (IOException e) {
            throw new ReportWriteException("WORKBOOK_WRITE_FAILED", "Failed to write workbook to output stream", e);
        }
    }

    public void writeToFile(Workbook workbook, Path path) {
        try {
            Path parent = path.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            try (OutputStream out = Files.newOutputStream(path)) {
                workbook.write(out);
            }
            log.info("Workbook written to {}", path);
        } catch (IOException e) {
            throw new ReportWriteException("FILE_WRITE_FAILED", "Failed to write workbook to " + path, e);
        }
    }
}
