package models;

import com.fasterxml.jackson.databind.JsonNode;

import java.io.Serializable;
import java.util.Objects;

/**
 * Represents a single news article as the NewsDesk reader shows and bookmarks it.
 * <p>
 * Each {@code Article} stores the metadata retrieved from the News API: title,
 * description, article URL, image URL, publication timestamp and source name.
 * The {@code url} is the article's identity; it keys bookmarks and
 * de-duplication. Fields are immutable and never {@code null}.
 * </p>
 *
 * <p>Example usage:</p>
 * <pre>
 *     Article article = Article.fromJson(node);
 *     article.title;           // "AI Achieves New Milestone"
 *     article.publishedDate(); // "2024-08-01"
 * </pre>
 */
public class Article implements Serializable {

    private static final long serialVersionUID = 1L;

    /** The title of the news article. */
    public final String title;

    /** A short summary or description of the article. */
    public final String description;

    /** The direct URL linking to the full article; unique per article. */
    public final String url;

    /** Link to the article's lead image ({@code urlToImage} in the News API). */
    public final String imageUrl;

    /** The publication date in ISO-8601 format (from the News API). */
    public final String publishedAt;

    /** The name of the news source or publisher. */
    public final String source;

    /**
     * Constructs an {@code Article} with all of its properties.
     * {@code null} arguments are stored as empty strings.
     *
     * @param title       the headline or title of the article
     * @param description a brief summary describing the article
     * @param url         the web link where the full article can be accessed
     * @param imageUrl    the article's lead image
     * @param publishedAt ISO-8601 publication timestamp
     * @param source      the name of the article's source or publisher
     */
    public Article(String title, String description, String url,
                   String imageUrl, String publishedAt, String source) {
        this.title = orEmpty(title);
        this.description = orEmpty(description);
        this.url = orEmpty(url);
        this.imageUrl = orEmpty(imageUrl);
        this.publishedAt = orEmpty(publishedAt);
        this.source = orEmpty(source);
    }

    /**
     * Maps one item of a News API {@code articles} array.
     * <p>
     * Missing or {@code null} fields become empty strings. A missing or
     * malformed {@code source} object yields an empty source name.
     * </p>
     *
     * @param node a single article node
     * @return the normalized article; {@code null} only when {@code node} is {@code null}
     */
    public static Article fromJson(JsonNode node) {
        if (node == null) return null;
        return new Article(
                node.path("title").asText(""),
                node.path("description").asText(""),
                node.path("url").asText(""),
                node.path("urlToImage").asText(""),
                node.path("publishedAt").asText(""),
                node.path("source").path("name").asText("")
        );
    }

    /**
     * The calendar-date part of {@link #publishedAt} for list and detail views.
     *
     * @return the first ten characters ({@code yyyy-MM-dd}), or the whole value when shorter
     */
    public String publishedDate() {
        String value = orEmpty(publishedAt);
        return value.length() > 10 ? value.substring(0, 10) : value;
    }

    private static String orEmpty(String s) {
        return s == null ? "" : s;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Article other = (Article) o;
        return Objects.equals(title, other.title)
                && Objects.equals(description, other.description)
                && Objects.equals(url, other.url)
                && Objects.equals(imageUrl, other.imageUrl)
                && Objects.equals(publishedAt, other.publishedAt)
                && Objects.equals(source, other.source);
    }

    @Override
    public int hashCode() {
        return Objects.hash(title, description, url, imageUrl, publishedAt, source);
    }

    @Override
    public String toString() {
        return "Article{url='" + url + "', title='" + title + "', source='" + source + "'}";
    }
}
