package com.safee.jobs.db;

import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.CoreMatchers.nullValue;
import static org.hamcrest.MatcherAssert.assertThat;

import java.util.List;
import java.util.Map;

import org.junit.Test;

public class JsonColumnsTest {

    @Test
    public void jacksonModulesShareOneVersion() {
        assertThat(com.fasterxml.jackson.core.json.PackageVersion.VERSION,
                is(com.fasterxml.jackson.databind.cfg.PackageVersion.VERSION));
    }

    @Test
    public void writesAndReadsNestedObjects() {
        String json = JsonColumns.write(Map.of("to", "a@example.com", "ids", List.of(1, 2)));

        Map<String, Object> back = JsonColumns.read(json);
        assertThat(back.get("to"), is("a@example.com"));
        assertThat(back.get("ids"), is(List.of(1, 2)));
    }

    @Test
    public void nullAndEmptyColumnsReadAsNull() {
        assertThat(JsonColumns.write(null), nullValue());
        assertThat(JsonColumns.read(null), nullValue());
        assertThat(JsonColumns.read(""), nullValue());
    }

    @Test(expected = IllegalStateException.class)
    public void nonObjectColumnIsRejected() {
        JsonColumns.read("[1,2]");
    }
}
