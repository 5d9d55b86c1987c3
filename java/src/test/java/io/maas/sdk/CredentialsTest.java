package io.maas.sdk;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class CredentialsTest {

    @Test
    void parsesThreeComponentKey() {
        Credentials credentials = Credentials.parse("consumerKey:tokenKey:tokenSecret");

        assertFalse(credentials.isAnonymous());
        assertEquals("consumerKey", credentials.consumerKey());
        assertEquals("tokenKey", credentials.tokenKey());
        assertEquals("tokenSecret", credentials.tokenSecret());
    }

    @Test
    void keepsEmptyComponents() {
        Credentials credentials = Credentials.parse("::");

        assertFalse(credentials.isAnonymous());
        assertEquals("", credentials.consumerKey());
        assertEquals("", credentials.tokenKey());
        assertEquals("", credentials.tokenSecret());
    }

    @Test
    void emptyKeyIsAnonymous() {
        assertTrue(Credentials.parse(null).isAnonymous());
        assertTrue(Credentials.parse("").isAnonymous());
    }

    @Test
    void whitespaceKeyIsRejected() {
        IllegalArgumentException ex = assertThrows(IllegalArgumentException.class, () -> Credentials.parse("   "));
        assertTrue(ex.getMessage().contains("invalid API key"));
    }

    @Test
    void rejectsWrongArity() {
        IllegalArgumentException tooFew = assertThrows(IllegalArgumentException.class, () -> Credentials.parse("invalid-key"));
        assertTrue(tooFew.getMessage().contains("invalid API key"));

        IllegalArgumentException tooMany = assertThrows(IllegalArgumentException.class, () -> Credentials.parse("a:b:c:d"));
        assertTrue(tooMany.getMessage().contains("invalid API key"));
        assertFalse(tooMany.getMessage().contains("b:c:d"), "secrets must not leak into the message");
    }

    @Test
    void toStringHidesSecrets() {
        String rendered = Credentials.parse("consumer:token:secret").toString();

        assertTrue(rendered.contains("consumer"));
        assertFalse(rendered.contains("secret"));
    }
}
