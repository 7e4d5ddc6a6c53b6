package com.daniel.feedarr.feed;

import java.nio.charset.StandardCharsets; // Feed bytes are always UTF-8.
import java.time.Clock; // Injected time source so "now" fallbacks are testable.
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList; // Mutable lists for items, categories and foreign markup.
import java.util.Date; // RSS Channel/Item date type expected by Rome.
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.stream.StreamSupport;

import org.jdom2.Element; // XML element type used for extension tags (dc:creator, atom:link).
import org.jdom2.Namespace; // XML namespace declaration for extension tags.
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service; // Marks this class as a Spring-managed service bean.

import com.daniel.feedarr.config.FeedarrProperties; // Public URL and cache TTL used in channel metadata.
import com.daniel.feedarr.upstream.FeedRecords; // Normalized list form of an upstream payload.
import com.fasterxml.jackson.databind.JsonNode; // One upstream record (movie, notification or queue entry).
import com.rometools.rome.feed.rss.Category; // RSS <category> for channel and items.
import com.rometools.rome.feed.rss.Channel; // RSS channel root object.
import com.rometools.rome.feed.rss.Description; // RSS description object with type/value.
import com.rometools.rome.feed.rss.Guid; // RSS GUID object for item identity.
import com.rometools.rome.feed.rss.Item; // RSS item object for each record.
import com.rometools.rome.io.FeedException; // Exception thrown by Rome during XML serialization.
import com.rometools.rome.io.WireFeedOutput; // Serializes Rome objects into RSS XML text.

@Service
public class RssFeedService {

    /*
     * Feed materializer: turns the records of one feed kind into an RSS 2.0 document and
     * persists it through FeedArtifactStore.
     * - channel boilerplate is identical for all kinds except title/description/url
     * - one <item> per record, built by the per-kind mapper below
     * - an empty record list is still a valid channel with zero items
     */
    private static final Logger log = LoggerFactory.getLogger(RssFeedService.class);

    public static final String CONTENT_TYPE = "application/rss+xml;charset=UTF-8";

    private static final Namespace DUBLIN_CORE_NS = Namespace.getNamespace("dc", "http://purl.org/dc/elements/1.1/");
    private static final Namespace ATOM_NS = Namespace.getNamespace("atom", "http://www.w3.org/2005/Atom");
    private static final String PUBLISHER = "Feedarr";
    private static final List<String> CHANNEL_CATEGORIES = List.of("Movies", "Media");
    private static final String PLACEHOLDER_LINK = "#";
    private static final String IMDB_TITLE_URL = "https://www.imdb.com/title/";
    private static final int MAX_GENRE_CATEGORIES = 3;

    private final FeedarrProperties properties;
    private final FeedArtifactStore artifactStore;
    private final Clock clock;

    public RssFeedService(FeedarrProperties properties, FeedArtifactStore artifactStore, Clock clock) {
        this.properties = properties;
        this.artifactStore = artifactStore;
        this.clock = clock;
    }

    // Builds, writes and returns the document; the previous artifact is replaced atomically.
    public RssDocument materialize(FeedKind kind, FeedRecords records) {
        String xml = buildFeedXml(kind, records);
        byte[] content = xml.getBytes(StandardCharsets.UTF_8);
        artifactStore.write(kind, content);
        log.debug("Materialized {} feed with {} items", kind, records.size());
        return new RssDocument(kind, content, CONTENT_TYPE, records.size());
    }

    public String buildFeedXml(FeedKind kind, FeedRecords records) {
        Instant now = clock.instant();
        Channel channel = createBaseChannel(kind, now);
        channel.setItems(records.records().stream()
                .map(record -> toItem(kind, record, now))
                .toList());

        try {
            return new WireFeedOutput().outputString(channel);
        } catch (FeedException ex) {
            throw new IllegalStateException("Failed to build " + kind + " RSS XML", ex);
        }
    }

    public String feedUrl(FeedKind kind) {
        return properties.normalizedPublicUrl() + "/rss/" + kind.id();
    }

    private Channel createBaseChannel(FeedKind kind, Instant now) {
        String feedUrl = feedUrl(kind);

        Channel channel = new Channel("rss_2.0");
        channel.setTitle(kind.channelTitle());
        channel.setDescription(kind.channelDescription());
        channel.setLink(feedUrl);
        channel.setLanguage("en");
        channel.setManagingEditor(PUBLISHER);
        channel.setWebMaster(PUBLISHER);
        channel.setGenerator(PUBLISHER);
        channel.setCopyright(String.valueOf(now.atOffset(ZoneOffset.UTC).getYear()));
        channel.setCategories(categories(CHANNEL_CATEGORIES));
        channel.setPubDate(Date.from(now));
        channel.setLastBuildDate(Date.from(now));
        channel.setTtl((int) Math.max(1, properties.effectiveCacheTtl().toMinutes()));

        List<Element> foreignMarkup = new ArrayList<>();
        Element creator = new Element("creator", DUBLIN_CORE_NS);
        creator.setText(PUBLISHER);
        foreignMarkup.add(creator);
        // Self link lets readers discover the canonical feed URL.
        Element selfLink = new Element("link", ATOM_NS);
        selfLink.setAttribute("href", feedUrl);
        selfLink.setAttribute("rel", "self");
        selfLink.setAttribute("type", "application/rss+xml");
        foreignMarkup.add(selfLink);
        channel.setForeignMarkup(foreignMarkup);
        return channel;
    }

    private Item toItem(FeedKind kind, JsonNode record, Instant now) {
        return switch (kind) {
            case CALENDAR -> toCalendarItem(record, now);
            case NOTIFICATION -> toNotificationItem(record, now);
            case QUEUE -> toQueueItem(record, now);
        };
    }

    /*
     * Calendar movie:
     * - pubDate = digital release, else physical release, else in-cinemas, else now
     * - categories = Movie, status, first three genres
     */
    private Item toCalendarItem(JsonNode movie, Instant now) {
        Optional<ReleaseDate> inCinemas = date(movie, "inCinemas");
        Optional<ReleaseDate> digitalRelease = date(movie, "digitalRelease");
        Optional<ReleaseDate> physicalRelease = date(movie, "physicalRelease");
        Optional<String> status = text(movie, "status");
        List<String> genres = texts(movie, "genres");

        Item item = new Item();
        item.setTitle(text(movie, "title").orElse("Unknown Movie"));
        item.setLink(imdbLink(movie));
        item.setPubDate(Date.from(digitalRelease
                .or(() -> physicalRelease)
                .or(() -> inCinemas)
                .map(ReleaseDate::instant)
                .orElse(now)));
        item.setGuid(guid("calendar", movie, now));

        HtmlDescription description = HtmlDescription.create()
                .paragraph("Overview", text(movie, "overview"))
                .paragraph("Year", text(movie, "year"))
                .paragraph("Status", status)
                .paragraph("In Cinemas", inCinemas.map(ReleaseDate::toIsoDate))
                .paragraph("Digital Release", digitalRelease.map(ReleaseDate::toIsoDate))
                .paragraph("Physical Release", physicalRelease.map(ReleaseDate::toIsoDate));
        if (!genres.isEmpty()) {
            description.paragraph("Genres", String.join(", ", genres));
        }
        item.setDescription(htmlDescription(description.render("No additional information available.")));

        List<String> categories = new ArrayList<>();
        categories.add("Movie");
        status.ifPresent(categories::add);
        genres.stream().limit(MAX_GENRE_CATEGORIES).forEach(categories::add);
        item.setCategories(categories(categories));
        return item;
    }

    // Notifications carry no date of their own, so pubDate is always the build time.
    private Item toNotificationItem(JsonNode notification, Instant now) {
        Optional<String> implementation = text(notification, "implementationName");

        Item item = new Item();
        item.setTitle(text(notification, "name").orElse("System Notification"));
        item.setLink(PLACEHOLDER_LINK);
        item.setPubDate(Date.from(now));
        item.setGuid(guid("notification", notification, now));

        HtmlDescription description = HtmlDescription.create()
                .paragraph("Implementation", implementation.orElse("Unknown"));
        JsonNode fields = notification.path("fields");
        if (fields.isArray() && fields.size() > 0) {
            description.paragraph("Configuration Fields", fields.size() + " fields configured");
        }
        description.paragraph("Contract", text(notification, "configContract"));
        item.setDescription(htmlDescription(description.render("Notification configuration details.")));

        List<String> categories = new ArrayList<>();
        categories.add("Notification");
        implementation.ifPresent(categories::add);
        item.setCategories(categories(categories));
        return item;
    }

    /*
     * Queue entry:
     * - title = "<movie title> - <status>"
     * - progress = (size - sizeleft) / size * 100, one decimal, only when both sizes exist and size > 0
     */
    private Item toQueueItem(JsonNode entry, Instant now) {
        JsonNode movie = entry.path("movie");
        Optional<String> status = text(entry, "status");

        Item item = new Item();
        item.setTitle(text(movie, "title").orElse("Unknown Movie") + " - " + status.orElse("Unknown Status"));
        item.setLink(imdbLink(movie));
        item.setPubDate(Date.from(date(entry, "added").map(ReleaseDate::instant).orElse(now)));
        item.setGuid(guid("queue", entry, now));

        HtmlDescription description = HtmlDescription.create()
                .paragraph("Status", status.orElse("Unknown"))
                .paragraph("Progress", progress(entry));
        if (entry.path("quality").isObject()) {
            description.paragraph("Quality", text(entry.path("quality").path("quality"), "name").orElse("Unknown"));
        }
        description
                .paragraph("Protocol", text(entry, "protocol"))
                .paragraph("Indexer", text(entry, "indexer"))
                .paragraph("Movie Overview", text(movie, "overview"));
        item.setDescription(htmlDescription(description.render("Queue item details.")));

        item.setCategories(categories(List.of("Queue", status.orElse("Unknown"))));
        return item;
    }

    private Optional<String> progress(JsonNode entry) {
        JsonNode size = entry.path("size");
        JsonNode sizeLeft = entry.path("sizeleft");
        if (!size.isNumber() || !sizeLeft.isNumber() || size.asDouble() <= 0) {
            return Optional.empty();
        }
        double percent = (size.asDouble() - sizeLeft.asDouble()) / size.asDouble() * 100;
        return Optional.of(String.format(Locale.ROOT, "%.1f%%", percent));
    }

    private String imdbLink(JsonNode movie) {
        return text(movie, "imdbId").map(id -> IMDB_TITLE_URL + id).orElse(PLACEHOLDER_LINK);
    }

    /*
     * guid = <kind>-<id>, or <kind>-<build time in millis> when the record has no id.
     * Records without an id therefore share a guid within one build; readers may collapse them.
     */
    private Guid guid(String prefix, JsonNode record, Instant now) {
        Guid guid = new Guid();
        guid.setPermaLink(false);
        guid.setValue(prefix + "-" + text(record, "id").orElse(String.valueOf(now.toEpochMilli())));
        return guid;
    }

    private Description htmlDescription(String html) {
        Description description = new Description();
        description.setType("text/html");
        description.setValue(html);
        return description;
    }

    private List<Category> categories(List<String> values) {
        List<Category> categories = new ArrayList<>(values.size());
        for (String value : values) {
            Category category = new Category();
            category.setValue(value);
            categories.add(category);
        }
        return categories;
    }

    // Scalar field as trimmed text; null, blank, missing or structured values count as absent.
    private static Optional<String> text(JsonNode node, String field) {
        JsonNode value = node.path(field);
        if (!value.isValueNode() || value.isNull()) {
            return Optional.empty();
        }
        String text = value.asText().trim();
        return text.isEmpty() ? Optional.empty() : Optional.of(text);
    }

    private static List<String> texts(JsonNode node, String field) {
        JsonNode array = node.path(field);
        if (!array.isArray()) {
            return List.of();
        }
        return StreamSupport.stream(array.spliterator(), false)
                .filter(JsonNode::isValueNode)
                .map(JsonNode::asText)
                .filter(value -> !value.isBlank())
                .toList();
    }

    private static Optional<ReleaseDate> date(JsonNode node, String field) {
        return text(node, field).flatMap(ReleaseDate::parse);
    }
}
