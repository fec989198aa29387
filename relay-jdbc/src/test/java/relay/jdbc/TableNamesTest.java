package relay.jdbc;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

class TableNamesTest {

    @Test
    void validTableNameReturnsName() {
        assertEquals("relay_audit_event", TableNames.validate("relay_audit_event"));
        assertEquals("MyTable", TableNames.validate("MyTable"));
        assertEquals("_table", TableNames.validate("_table"));
    }

    @Test
    void defaultPrefixNamesEveryTable() {
        TableNames tables = TableNames.defaults();

        assertEquals("relay_connector_delivery", tables.deliveries());
        assertEquals("relay_delivery_attempt", tables.attempts());
        assertEquals("relay_audit_event", tables.auditEvents());
        assertEquals("relay_backpressure_policy", tables.policies());
        assertEquals("relay_backpressure_draft", tables.drafts());
        assertEquals("relay_guardian_policy", tables.guardianPolicies());
    }

    @Test
    void emptyPrefixIsAllowed() {
        assertEquals("connector_delivery", TableNames.withPrefix("").deliveries());
    }

    @Test
    void prefixThatBreaksIdentifiersIsRejected() {
        assertThrows(IllegalArgumentException.class, () -> TableNames.withPrefix("ops-"));
        assertThrows(IllegalArgumentException.class, () -> TableNames.withPrefix("1_"));
        assertThrows(IllegalArgumentException.class, () -> TableNames.withPrefix("x; DROP TABLE y; --"));
    }

    @Test
    void nullIsRejected() {
        assertThrows(NullPointerException.class, () -> TableNames.validate(null));
        assertThrows(NullPointerException.class, () -> TableNames.withPrefix(null));
    }

    @Test
    void emptyTableNameThrows() {
        assertThrows(IllegalArgumentException.class, () -> TableNames.validate(""));
    }
}
