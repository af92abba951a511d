package work.cmdkernel.bind;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;
import work.cmdkernel.bind.ArgumentTokenizer.Kind;

class ArgumentTokenizerTest {
    @Test
    void classifiesLongOptionsWithAndWithoutInlineValue() {
        var plain = ArgumentTokenizer.classify("--message", false, c -> false);
        assertEquals(Kind.LONG, plain.kind());
        assertEquals("message", plain.name());
        assertNull(plain.inlineValue());

        var inline = ArgumentTokenizer.classify("--message=a=b", false, c -> false);
        assertEquals("message", inline.name());
        assertEquals("a=b", inline.inlineValue());
        assertEquals("--message", inline.display());
    }

    @Test
    void classifiesShortOptions() {
        var token = ArgumentTokenizer.classify("-m", false, c -> c == 'm');
        assertEquals(Kind.SHORT, token.kind());
        assertEquals("m", token.name());
        var inline = ArgumentTokenizer.classify("-m=fix", false, c -> c == 'm');
        assertEquals("fix", inline.inlineValue());
    }

    @Test
    void negativeNumbersAreValuesUnlessDeclaredAsShortNames() {
        assertEquals(Kind.VALUE, ArgumentTokenizer.classify("-5", false, c -> false).kind());
        assertEquals(Kind.VALUE, ArgumentTokenizer.classify("-2.5e3", false, c -> false).kind());
        assertEquals(Kind.SHORT, ArgumentTokenizer.classify("-5", false, c -> c == '5').kind());
    }

    @Test
    void separatorEndsOptionParsing() {
        assertEquals(Kind.END, ArgumentTokenizer.classify("--", false, c -> false).kind());
        assertEquals(Kind.VALUE, ArgumentTokenizer.classify("--force", true, c -> false).kind());
        assertEquals(Kind.VALUE, ArgumentTokenizer.classify("-", false, c -> false).kind());
    }

    @Test
    void looksLikeOptionIgnoresNumbersAndPlainWords() {
        assertTrue(ArgumentTokenizer.looksLikeOption("--verbose"));
        assertTrue(ArgumentTokenizer.looksLikeOption("--"));
        assertFalse(ArgumentTokenizer.looksLikeOption("-12"));
        assertFalse(ArgumentTokenizer.looksLikeOption("git"));
        assertFalse(ArgumentTokenizer.looksLikeOption("-"));
    }
}
