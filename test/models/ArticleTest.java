package models;

import com.fasterxml.jackson.databind.JsonNode;
import org.junit.jupiter.api.Test;
import play.libs.Json;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for the {@link Article} model.
 * <p>
 * Verifies that:
 * <ul>
 *   <li>The all-args constructor assigns public fields and turns {@code null} into {@code ""}.</li>
 *   <li>{@link Article#fromJson(JsonNode)} is permissive about missing or malformed fields.</li>
 *   <li>Display truncation of the publication date never fails.</li>
 * </ul>
 */
public class ArticleTest {

    @Test
    void constructor_setsPublicFields() {
        Article a = new Article(
                "Title",
                "Desc",
                "https://example.com",
                "https://example.com/img.png",
                "2024-08-01T12:34:56Z",
                "The Verge"
        );

        assertEquals("Title", a.title);
        assertEquals("Desc", a.description);
        assertEquals("https://example.com", a.url);
        assertEquals("https://example.com/img.png", a.imageUrl);
        assertEquals("2024-08-01T12:34:56Z", a.publishedAt);
        assertEquals("The Verge", a.source);
    }

    @Test
    void constructor_nullsBecomeEmpty() {
        Article a = new Article(null, null, "https://example.com", null, null, null);

        assertEquals("", a.title);
        assertEquals("", a.description);
        assertEquals("", a.imageUrl);
        assertEquals("", a.publishedAt);
        assertEquals("", a.source);
    }

    @Test
    void fromJson_mapsNewsApiShape() throws Exception {
        JsonNode node = Json.mapper().readTree("{"
                + "\"source\":{\"id\":\"bbc-news\",\"name\":\"BBC News\"},"
                + "\"title\":\"Headline\","
                + "\"description\":\"Summary\","
                + "\"url\":\"https://bbc.co.uk/1\","
                + "\"urlToImage\":\"https://bbc.co.uk/1.jpg\","
                + "\"publishedAt\":\"2024-10-14T09:00:00Z\"}");

        Article a = Article.fromJson(node);

        assertEquals(new Article("Headline", "Summary", "https://bbc.co.uk/1",
                "https://bbc.co.uk/1.jpg", "2024-10-14T09:00:00Z", "BBC News"), a);
    }

    @Test
    void fromJson_nullAndMissingFields_defaultToEmpty() throws Exception {
        JsonNode node = Json.mapper().readTree(
                "{\"title\":null,\"url\":\"https://x.com/a\",\"urlToImage\":null,\"source\":{\"id\":null,\"name\":null}}");

        Article a = Article.fromJson(node);

        assertEquals("", a.title);
        assertEquals("", a.description);
        assertEquals("https://x.com/a", a.url);
        assertEquals("", a.imageUrl);
        assertEquals("", a.publishedAt);
        assertEquals("", a.source);
    }

    @Test
    void fromJson_malformedSource_yieldsEmptySource() throws Exception {
        assertEquals("", Article.fromJson(Json.mapper().readTree("{\"url\":\"u\",\"source\":\"CNN\"}")).source);
        assertEquals("", Article.fromJson(Json.mapper().readTree("{\"url\":\"u\",\"source\":null}")).source);
        assertEquals("", Article.fromJson(Json.mapper().readTree("{\"url\":\"u\",\"source\":[1,2]}")).source);
        assertEquals("", Article.fromJson(Json.mapper().readTree("{\"url\":\"u\"}")).source);
    }

    @Test
    void fromJson_null_returnsNull() {
        assertNull(Article.fromJson(null));
    }

    @Test
    void publishedDate_truncatesToDay() {
        Article a = new Article("", "", "u", "", "2024-10-14T13:05:00Z", "");
        assertEquals("2024-10-14", a.publishedDate());
    }

    @Test
    void publishedDate_shortOrEmptyValue_returnedAsIs() {
        assertEquals("2024-10", new Article("", "", "u", "", "2024-10", "").publishedDate());
        assertEquals("", new Article("", "", "u", "", null, "").publishedDate());
    }

    @Test
    void equals_comparesAllFields() {
        Article a = new Article("T", "D", "u", "i", "p", "s");
        Article sameUrlOtherTitle = new Article("T2", "D", "u", "i", "p", "s");

        assertEquals(a, new Article("T", "D", "u", "i", "p", "s"));
        assertEquals(a.hashCode(), new Article("T", "D", "u", "i", "p", "s").hashCode());
        assertNotEquals(a, sameUrlOtherTitle);
    }
}
