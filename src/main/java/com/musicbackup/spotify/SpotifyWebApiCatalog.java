package com.musicbackup.spotify;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.musicbackup.sync.AuthExpiredException;
import com.musicbackup.sync.BackupConfig;
import com.musicbackup.sync.CatalogException;
import com.musicbackup.sync.Page;
import com.musicbackup.sync.Playlist;
import com.musicbackup.sync.RateLimitedException;
import com.musicbackup.sync.RemoteCatalog;
import com.musicbackup.sync.Track;
import com.musicbackup.sync.TransientFetchException;
import com.musicbackup.sync.UserProfile;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Base64;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Function;

/**
 * {@link RemoteCatalog} backed by the Spotify Web API.
 * <p>
 * Workflow:
 * <ul>
 *   <li>Issues HTTP GET requests with a bearer token and parses JSON responses into the sync model.</li>
 *   <li>Maps HTTP 429 to {@link RateLimitedException} using the {@code Retry-After} header.</li>
 *   <li>Maps HTTP 401 to {@link AuthExpiredException}; {@link #refreshCredentials()} runs the refresh-token grant.</li>
 *   <li>Maps every other failure, including timeouts, to {@link TransientFetchException}.</li>
 * </ul>
 * Unavailable items (null tracks in a page) are skipped.
 *
 * @author Music Library Backup Team
 * @since 1.0
 */
public class SpotifyWebApiCatalog implements RemoteCatalog {
    private static final Logger logger = LoggerFactory.getLogger(SpotifyWebApiCatalog.class);

    static final URI DEFAULT_API_BASE = URI.create("https://api.spotify.com/v1/");
    static final URI DEFAULT_TOKEN_URI = URI.create("https://accounts.spotify.com/api/token");
    private static final Duration REQUEST_TIMEOUT = Duration.ofSeconds(30);
    private static final String PLAYLIST_FIELDS =
        "id,uri,name,description,owner(id,display_name),public,collaborative,snapshot_id,external_urls,tracks.total";

    private final HttpClient client;
    private final ObjectMapper mapper = new ObjectMapper();
    private final URI apiBase;
    private final URI tokenUri;
    private final String clientId;
    private final String clientSecret;
    private volatile String accessToken;
    private volatile String refreshToken;

    public SpotifyWebApiCatalog(String accessToken, String refreshToken, String clientId, String clientSecret) {
        this(HttpClient.newBuilder().connectTimeout(REQUEST_TIMEOUT).build(), DEFAULT_API_BASE, DEFAULT_TOKEN_URI,
            accessToken, refreshToken, clientId, clientSecret);
    }

    SpotifyWebApiCatalog(HttpClient client, URI apiBase, URI tokenUri, String accessToken, String refreshToken,
                         String clientId, String clientSecret) {
        this.client = client;
        this.apiBase = apiBase;
        this.tokenUri = tokenUri;
        this.accessToken = accessToken == null ? "" : accessToken;
        this.refreshToken = refreshToken == null ? "" : refreshToken;
        this.clientId = clientId == null ? "" : clientId;
        this.clientSecret = clientSecret == null ? "" : clientSecret;
    }

    public static SpotifyWebApiCatalog fromConfig(BackupConfig config) {
        return new SpotifyWebApiCatalog(config.accessToken(), config.refreshToken(), config.clientId(), config.clientSecret());
    }

    @Override
    public UserProfile getCurrentUser() throws CatalogException {
        return parseUser(get("me"));
    }

    @Override
    public Page<Playlist> listPlaylists(int offset, int limit) throws CatalogException {
        JsonNode root = get("me/playlists?offset=" + offset + "&limit=" + limit);
        return parsePage(root, offset, limit, SpotifyWebApiCatalog::parsePlaylist);
    }

    @Override
    public Page<Track> listPlaylistTracks(String playlistId, int offset, int limit) throws CatalogException {
        JsonNode root = get("playlists/" + encode(playlistId) + "/tracks?offset=" + offset + "&limit=" + limit);
        return parsePage(root, offset, limit, SpotifyWebApiCatalog::parseTrackItem);
    }

    @Override
    public Page<Track> listLikedTracks(int offset, int limit) throws CatalogException {
        JsonNode root = get("me/tracks?offset=" + offset + "&limit=" + limit);
        return parsePage(root, offset, limit, SpotifyWebApiCatalog::parseTrackItem);
    }

    @Override
    public Playlist getPlaylist(String playlistId) throws CatalogException {
        Playlist playlist = parsePlaylist(get("playlists/" + encode(playlistId) + "?fields=" + encode(PLAYLIST_FIELDS)));
        if (playlist == null) {
            throw new TransientFetchException("Playlist response for " + playlistId + " has no id");
        }
        return playlist;
    }

    @Override
    public List<String> getArtistGenres(String artistId) throws CatalogException {
        return parseGenres(get("artists/" + encode(artistId)));
    }

    @Override
    public boolean refreshCredentials() {
        if (refreshToken.isBlank() || clientId.isBlank() || clientSecret.isBlank()) {
            logger.warn("Cannot refresh access token: refresh token or client credentials are not configured.");
            return false;
        }
        String form = "grant_type=refresh_token&refresh_token=" + encode(refreshToken);
        String basic = Base64.getEncoder().encodeToString((clientId + ":" + clientSecret).getBytes(StandardCharsets.UTF_8));
        HttpRequest request = HttpRequest.newBuilder(tokenUri)
            .timeout(REQUEST_TIMEOUT)
            .header("Authorization", "Basic " + basic)
            .header("Content-Type", "application/x-www-form-urlencoded")
            .POST(HttpRequest.BodyPublishers.ofString(form))
            .build();
        try {
            HttpResponse<String> response = client.send(request, HttpResponse.BodyHandlers.ofString());
            if (response.statusCode() != 200) {
                logger.error("Token refresh failed with HTTP {}: {}", response.statusCode(), snippet(response.body()));
                return false;
            }
            JsonNode root = mapper.readTree(response.body());
            String newToken = root.path("access_token").asText("");
            if (newToken.isBlank()) {
                logger.error("Token refresh response did not contain an access token.");
                return false;
            }
            accessToken = newToken;
            String rotated = root.path("refresh_token").asText("");
            if (!rotated.isBlank()) refreshToken = rotated;
            logger.info("Access token refreshed.");
            return true;
        } catch (IOException e) {
            logger.error("Token refresh failed: {}", e.getMessage());
            return false;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            logger.warn("Token refresh interrupted.");
            return false;
        }
    }

    private JsonNode get(String pathAndQuery) throws CatalogException {
        URI uri = apiBase.resolve(pathAndQuery);
        HttpRequest request = HttpRequest.newBuilder(uri)
            .timeout(REQUEST_TIMEOUT)
            .header("Authorization", "Bearer " + accessToken)
            .header("Accept", "application/json")
            .GET()
            .build();
        HttpResponse<String> response;
        try {
            response = client.send(request, HttpResponse.BodyHandlers.ofString());
        } catch (IOException e) {
            throw new TransientFetchException("Request to " + uri.getPath() + " failed: " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new TransientFetchException("Request to " + uri.getPath() + " interrupted", e);
        }

        int status = response.statusCode();
        if (status == 429) {
            Integer retryAfter = response.headers().firstValue("Retry-After").map(SpotifyWebApiCatalog::parseRetryAfterHeader).orElse(null);
            throw new RateLimitedException(retryAfter, "HTTP 429 from " + uri.getPath() + ": " + snippet(response.body()));
        }
        if (status == 401) {
            throw new AuthExpiredException("HTTP 401 from " + uri.getPath() + ": " + snippet(response.body()));
        }
        if (status < 200 || status >= 300) {
            throw new TransientFetchException("HTTP " + status + " from " + uri.getPath() + ": " + snippet(response.body()));
        }
        try {
            return mapper.readTree(response.body());
        } catch (IOException e) {
            throw new TransientFetchException("Unparseable response from " + uri.getPath() + ": " + e.getMessage(), e);
        }
    }

    // --- JSON mapping ---

    static Integer parseRetryAfterHeader(String value) {
        try {
            return Integer.valueOf(value.trim());
        } catch (NumberFormatException e) {
            return null;
        }
    }

    static UserProfile parseUser(JsonNode node) {
        return new UserProfile(node.path("id").asText(""), textOrNull(node, "display_name"), textOrNull(node, "email"));
    }

    static <T> Page<T> parsePage(JsonNode root, int offset, int limit, Function<JsonNode, T> itemMapper) {
        List<T> items = new ArrayList<>();
        JsonNode array = root.path("items");
        int rawCount = 0;
        if (array.isArray()) {
            for (JsonNode item : array) {
                rawCount++;
                if (item == null || item.isNull()) continue;
                T mapped = itemMapper.apply(item);
                if (mapped != null) items.add(mapped);
            }
        }
        int total = root.path("total").asInt(offset + rawCount);
        Integer next = null;
        JsonNode nextNode = root.path("next");
        if (!nextNode.isMissingNode() && !nextNode.isNull() && rawCount > 0) {
            next = offset + Math.max(rawCount, root.path("limit").asInt(limit));
        }
        return new Page<>(items, offset, total, next);
    }

    static Playlist parsePlaylist(JsonNode node) {
        String id = node.path("id").asText("");
        if (id.isBlank()) return null;
        JsonNode owner = node.path("owner");
        return new Playlist(
            id,
            node.path("uri").asText(""),
            node.path("name").asText("Unknown Playlist"),
            textOrNull(node, "description"),
            owner.path("id").asText(""),
            owner.path("display_name").asText(owner.path("id").asText("")),
            node.path("public").asBoolean(false),
            node.path("collaborative").asBoolean(false),
            node.path("snapshot_id").asText(""),
            node.path("tracks").path("total").asInt(0),
            null,
            null,
            parseUrls(node.path("external_urls")),
            List.of());
    }

    /**
     * Maps a playlist or library item ({@code added_at}, {@code added_by}, {@code track}); null when the track is gone.
     */
    static Track parseTrackItem(JsonNode item) {
        JsonNode track = item.path("track");
        if (track.isMissingNode() || track.isNull()) return null;
        List<String> artists = new ArrayList<>();
        List<String> artistIds = new ArrayList<>();
        for (JsonNode artist : track.path("artists")) {
            String name = artist.path("name").asText("");
            if (!name.isBlank()) artists.add(name);
            String artistId = artist.path("id").asText("");
            if (!artistId.isBlank()) artistIds.add(artistId);
        }
        if (artists.isEmpty()) artists.add("Unknown Artist");
        JsonNode album = track.path("album");
        return new Track(
            track.path("id").asText(""),
            track.path("uri").asText(""),
            track.path("name").asText("Unknown Track"),
            artists,
            artistIds,
            album.path("name").asText("Unknown Album"),
            album.path("id").asText(""),
            track.path("duration_ms").asLong(0),
            textOrNull(item, "added_at"),
            track.path("track_number").asInt(0),
            track.path("disc_number").asInt(1),
            track.path("explicit").asBoolean(false),
            track.path("is_local").asBoolean(item.path("is_local").asBoolean(false)),
            track.path("popularity").asInt(0),
            List.of(),
            textOrNull(album, "release_date"),
            parseUrls(track.path("external_urls")),
            textOrNull(track, "preview_url"),
            textOrNull(item.path("added_by"), "id"));
    }

    static List<String> parseGenres(JsonNode artist) {
        List<String> genres = new ArrayList<>();
        for (JsonNode genre : artist.path("genres")) {
            String g = genre.asText("");
            if (!g.isBlank()) genres.add(g);
        }
        return genres;
    }

    private static Map<String, String> parseUrls(JsonNode node) {
        Map<String, String> urls = new LinkedHashMap<>();
        node.fields().forEachRemaining(e -> urls.put(e.getKey(), e.getValue().asText("")));
        return urls;
    }

    private static String textOrNull(JsonNode node, String field) {
        JsonNode value = node.path(field);
        return value.isMissingNode() || value.isNull() ? null : value.asText();
    }

    private static String encode(String value) {
        return URLEncoder.encode(value, StandardCharsets.UTF_8);
    }

    private static String snippet(String body) {
        if (body == null) return "";
        String flat = body.replaceAll("\\s+", " ").trim();
        return flat.length() > 200 ? flat.substring(0, 200) + "..." : flat;
    }
}
