package com.vtb.threatscan.util;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayOutputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

class TextFilesTest {

    private static final String TASK_XML = "<Task><Exec><Command>C:\\Temp\\xmrig.exe</Command></Exec></Task>";

    @Test
    void decodesUtf16LittleEndianWithBom(@TempDir Path tempDir) throws Exception {
        ByteArrayOutputStream bytes = new ByteArrayOutputStream();
        bytes.write(0xFF);
        bytes.write(0xFE);
        bytes.write(TASK_XML.getBytes(StandardCharsets.UTF_16LE));
        Path file = tempDir.resolve("UpdaterTask");
        Files.write(file, bytes.toByteArray());

        assertEquals(TASK_XML, TextFiles.readLenient(file));
    }

    @Test
    void decodesUtf8WithAndWithoutBom() {
        byte[] plain = TASK_XML.getBytes(StandardCharsets.UTF_8);
        byte[] withBom = new byte[plain.length + 3];
        withBom[0] = (byte) 0xEF;
        withBom[1] = (byte) 0xBB;
        withBom[2] = (byte) 0xBF;
        System.arraycopy(plain, 0, withBom, 3, plain.length);

        assertEquals(TASK_XML, TextFiles.decode(plain));
        assertEquals(TASK_XML, TextFiles.decode(withBom));
    }

    @Test
    void emptyInputDecodesToEmptyString() {
        assertEquals("", TextFiles.decode(new byte[0]));
    }

    @Test
    void sha256OfKnownContent() {
        assertEquals("ba7816bf8f01cfea414140de5dae2223b00361a396177a9cb410ff61f20015ad",
            FileHashing.sha256Hex("abc".getBytes(StandardCharsets.US_ASCII)));
    }
}
