package courier.travel.mail;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;

class HtmlTextTest {

    @Test
    void stripRemovesTagsAndKeepsLines() {
        String html = "<html>\n<body>\n<h2>Hello</h2>\n<ul>\n  <li><strong>Name:</strong> Abebe</li>\n</ul>\n"
                + "<p>Best regards,<br>Team</p>\n</body>\n</html>\n";

        assertEquals("Hello\n\nName: Abebe\n\nBest regards,\nTeam", HtmlText.strip(html));
    }

    @Test
    void stripDecodesEntities() {
        assertEquals("A & B <c> \"d\" 'e'", HtmlText.strip("A &amp; B &lt;c&gt; &quot;d&quot; &#39;e&#39;"));
    }

    @Test
    void escapeIsReversedByStrip() {
        String raw = "Tom & Jerry's <cabin>";
        assertEquals("Tom &amp; Jerry&#39;s &lt;cabin&gt;", HtmlText.escape(raw));
        assertEquals(raw, HtmlText.strip(HtmlText.escape(raw)));
    }

    @Test
    void escapeNullIsEmpty() {
        assertEquals("", HtmlText.escape(null));
    }
}
