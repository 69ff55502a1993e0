package com.receiptscan.app;

import org.junit.jupiter.api.Test;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class BootTest {

    @Test
    void parse_args_key_values_and_flags() {
        Map<String, String> a = Boot.parseArgs(new String[]{"--image=r.jpg", "--format=csv", "--totals", "stray"});
        assertEquals("r.jpg", a.get("image"));
        assertEquals("csv", a.get("format"));
        assertEquals("true", a.get("totals"));
        assertEquals(3, a.size());
    }

    @Test
    void bad_arguments_exit_with_2() {
        PrintStream out = new PrintStream(new ByteArrayOutputStream());
        assertEquals(2, Boot.run(new String[]{}, out));
        assertEquals(2, Boot.run(new String[]{"--image=a.png", "--dir=."}, out));
        assertEquals(2, Boot.run(new String[]{"--image=a.png", "--format=xml"}, out));
    }
}
