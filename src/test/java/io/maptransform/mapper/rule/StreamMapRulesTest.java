package io.maptransform.mapper.rule;

import io.maptransform.ion.IonTypeName;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.containsInAnyOrder;
import static org.hamcrest.Matchers.containsString;
import static org.hamcrest.Matchers.empty;
import static org.hamcrest.Matchers.instanceOf;
import static org.hamcrest.Matchers.is;
import static org.hamcrest.Matchers.nullValue;

class StreamMapRulesTest {
    @Test
    void classifiesRemovals() {
        assertThat(StreamMapRules.parse("users", null), is(new RemoveRule("users")));
        assertThat(StreamMapRules.parse("users", "__NULL__"), is(new RemoveRule("users")));
    }

    @Test
    void classifiesInvalidDefinitions() {
        InvalidRule string = (InvalidRule) StreamMapRules.parse("users", "__drop__");
        InvalidRule number = (InvalidRule) StreamMapRules.parse("users", 42);
        InvalidRule list = (InvalidRule) StreamMapRules.parse("users", List.of("a"));

        assertThat(string.reason(), is("Option 'users:__drop__' is not expected."));
        assertThat(number.reason(), containsString("Got 'Integer'"));
        assertThat(list.key(), is("users"));
    }

    @Test
    void consumesSourceAndAliasBeforeFields() {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("__source__", "orders");
        body.put("__alias__", "orders_audit");
        body.put("__filter__", "amount > 100");
        body.put("id", "id");
        body.put("total", Map.of("expr", "amount", "type", "decimal"));

        ProjectionRule rule = (ProjectionRule) StreamMapRules.parse("audit", body);

        assertThat(rule.source(), is("orders"));
        assertThat(rule.alias(), is("orders_audit"));
        assertThat(rule.filter(), is("amount > 100"));
        assertThat(rule.isPrimary(), is(false));
        assertThat(rule.fields(), contains(
            new FieldMapping("id", "id", null),
            new FieldMapping("total", "amount", IonTypeName.DECIMAL)
        ));
    }

    @Test
    void defaultsSourceAndAliasToKey() {
        ProjectionRule rule = (ProjectionRule) StreamMapRules.parse("orders", Map.of("id", "id"));

        assertThat(rule.source(), is("orders"));
        assertThat(rule.alias(), is("orders"));
        assertThat(rule.isPrimary(), is(true));
        assertThat(rule.overridesKeyProperties(), is(false));
        assertThat(rule.includeUnmapped(), is(true));
    }

    @Test
    void recordsExcludedFields() {
        Map<String, Object> body = new HashMap<>();
        body.put("email", null);
        body.put("phone", "__NULL__");
        body.put("id", "id");

        ProjectionRule rule = (ProjectionRule) StreamMapRules.parse("users", body);

        assertThat(rule.fields(), contains(new FieldMapping("id", "id", null)));
        assertThat(rule.excludedFields(), containsInAnyOrder("email", "phone"));
        assertThat(rule.includeUnmapped(), is(true));
    }

    @Test
    void readsKeyPropertiesOverride() {
        Map<String, Object> withKeys = new HashMap<>();
        withKeys.put("__key_properties__", List.of("email"));
        Map<String, Object> withoutKeys = new HashMap<>();
        withoutKeys.put("__key_properties__", null);

        ProjectionRule replaced = (ProjectionRule) StreamMapRules.parse("users", withKeys);
        ProjectionRule cleared = (ProjectionRule) StreamMapRules.parse("users", withoutKeys);

        assertThat(replaced.overridesKeyProperties(), is(true));
        assertThat(replaced.keyProperties(), contains("email"));
        assertThat(cleared.overridesKeyProperties(), is(true));
        assertThat(cleared.keyProperties(), is(nullValue()));
    }

    @Test
    void rejectsMalformedOptions() {
        assertThat(StreamMapRules.parse("users", Map.of("__source__", 3)), instanceOf(InvalidRule.class));
        assertThat(StreamMapRules.parse("users", Map.of("__filter__", true)), instanceOf(InvalidRule.class));
        assertThat(StreamMapRules.parse("users", Map.of("__key_properties__", "id")), instanceOf(InvalidRule.class));
        assertThat(StreamMapRules.parse("users", Map.of("__else__", "keep")), instanceOf(InvalidRule.class));
        assertThat(StreamMapRules.parse("users", Map.of("__unknown__", "x")), instanceOf(InvalidRule.class));
        assertThat(StreamMapRules.parse("users", Map.of("id", 5)), instanceOf(InvalidRule.class));
        assertThat(StreamMapRules.parse("users", Map.of("id", Map.of("expr", "id", "type", "money"))), instanceOf(InvalidRule.class));
    }

    @Test
    void acceptsNullElseInsideRule() {
        Map<String, Object> body = new HashMap<>();
        body.put("__else__", null);
        body.put("id", "id");

        ProjectionRule rule = (ProjectionRule) StreamMapRules.parse("users", body);

        assertThat(rule.includeUnmapped(), is(false));
        assertThat(rule.fields(), contains(new FieldMapping("id", "id", null)));
        assertThat(rule.excludedFields(), is(empty()));
    }

    @Test
    void keepsDeclarationOrder() {
        Map<String, Object> config = new LinkedHashMap<>();
        config.put("b", Map.of("id", "id"));
        config.put("a", null);
        config.put("c", "oops");

        StreamMapRules rules = StreamMapRules.fromMap(config);

        assertThat(rules.rules().stream().map(MapRule::key).toList(), contains("b", "a", "c"));
        assertThat(rules.removeUnmappedStreams(), is(false));
    }

    @Test
    void readsCatchAllElse() {
        StreamMapRules removing = StreamMapRules.builder()
            .rule("orders", Map.of("id", "id"))
            .rule("__else__", "__NULL__")
            .build();
        StreamMapRules invalid = StreamMapRules.builder()
            .rule("__else__", Arrays.asList("x"))
            .build();

        assertThat(removing.removeUnmappedStreams(), is(true));
        assertThat(removing.rules().size(), is(1));
        assertThat(invalid.removeUnmappedStreams(), is(false));
        assertThat(invalid.rules().get(0), instanceOf(InvalidRule.class));
    }
}
