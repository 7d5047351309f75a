package com.musicbackup.sync;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * A local folder for organizing playlists. The remote service does not expose folders, so the tree
 * exists only in the backup and is edited through {@link BackupEngineInterface#assignFolder(String, String)}.
 * <p>
 * Paths are slash separated ({@code Music/Rock}); a playlist belongs to at most one folder.
 *
 * @author Music Library Backup Team
 * @since 1.0
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record PlaylistFolder(
    @JsonProperty("name") String name,
    @JsonProperty("path") String path,
    @JsonProperty("parent_path") String parentPath,
    @JsonProperty("playlists") List<String> playlists,
    @JsonProperty("subfolders") List<PlaylistFolder> subfolders,
    @JsonProperty("display_order") int displayOrder,
    @JsonProperty("is_expanded") boolean expanded
) {
    public static final String SEPARATOR = "/";

    public PlaylistFolder {
        name = name == null ? "" : name;
        path = path == null ? name : path;
        playlists = Utils.nonNullList(playlists);
        subfolders = Utils.nonNullList(subfolders);
    }

    /**
     * Splits a user-supplied path into its non-blank segments, trimmed.
     */
    public static List<String> segments(String folderPath) {
        List<String> out = new ArrayList<>();
        if (folderPath == null) return out;
        for (String part : folderPath.split(SEPARATOR)) {
            if (!part.isBlank()) out.add(part.trim());
        }
        return out;
    }

    /**
     * Removes the playlist from every folder in the tree. Folders themselves are kept, even when empty.
     */
    public static List<PlaylistFolder> unassign(List<PlaylistFolder> folders, String playlistId) {
        List<PlaylistFolder> out = new ArrayList<>(folders.size());
        for (PlaylistFolder f : folders) {
            List<String> ids = new ArrayList<>(f.playlists);
            ids.remove(playlistId);
            out.add(new PlaylistFolder(f.name, f.path, f.parentPath, ids, unassign(f.subfolders, playlistId),
                f.displayOrder, f.expanded));
        }
        return out;
    }

    /**
     * Moves the playlist into the folder at the given path, creating missing folders along the way.
     * @param folders Current top-level folders
     * @param playlistId Playlist to place
     * @param folderPath Target path; blank removes the playlist from all folders
     * @return The new top-level folders
     */
    public static List<PlaylistFolder> assign(List<PlaylistFolder> folders, String playlistId, String folderPath) {
        List<PlaylistFolder> cleared = unassign(folders, playlistId);
        List<String> segments = segments(folderPath);
        if (segments.isEmpty()) return cleared;
        return insert(cleared, segments, 0, null, playlistId);
    }

    private static List<PlaylistFolder> insert(List<PlaylistFolder> level, List<String> segments, int depth,
                                               String parentPath, String playlistId) {
        String name = segments.get(depth);
        String path = parentPath == null ? name : parentPath + SEPARATOR + name;
        boolean last = depth == segments.size() - 1;
        List<PlaylistFolder> out = new ArrayList<>(level);
        int index = -1;
        for (int i = 0; i < out.size(); i++) {
            if (out.get(i).name.equals(name)) {
                index = i;
                break;
            }
        }
        PlaylistFolder target = index >= 0 ? out.get(index)
            : new PlaylistFolder(name, path, parentPath, List.of(), List.of(), out.size(), true);
        List<String> ids = target.playlists;
        List<PlaylistFolder> children = target.subfolders;
        if (last) {
            ids = new ArrayList<>(ids);
            ids.add(playlistId);
        } else {
            children = insert(children, segments, depth + 1, path, playlistId);
        }
        PlaylistFolder updated = new PlaylistFolder(target.name, target.path, target.parentPath, ids, children,
            target.displayOrder, target.expanded);
        if (index >= 0) {
            out.set(index, updated);
        } else {
            out.add(updated);
        }
        return out;
    }

    /**
     * Flattens the tree into playlist ID to folder path.
     */
    public static Map<String, String> assignments(List<PlaylistFolder> folders) {
        Map<String, String> out = new LinkedHashMap<>();
        collect(folders, out);
        return out;
    }

    private static void collect(List<PlaylistFolder> folders, Map<String, String> out) {
        for (PlaylistFolder f : folders) {
            for (String id : f.playlists) out.put(id, f.path);
            collect(f.subfolders, out);
        }
    }
}
