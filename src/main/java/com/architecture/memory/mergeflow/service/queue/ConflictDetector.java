package com.architecture.memory.mergeflow.service.queue;

import com.architecture.memory.mergeflow.dto.github.PullRequestFile;
import com.architecture.memory.mergeflow.dto.queue.FileOverlap;
import com.architecture.memory.mergeflow.dto.queue.LineRange;
import com.architecture.memory.mergeflow.model.MergeQueueItem;
import com.architecture.memory.mergeflow.service.github.GitProviderClient;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeSet;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Flags queued PRs that are likely to conflict textually with PRs queued ahead of them.
 *
 * By default any shared file counts. In line-level mode a shared file only counts when the
 * diff hunks of both PRs touch base-file lines within {@link #LINE_BUFFER} of each other,
 * or when either side has no patch to compare.
 */
@Component
@Slf4j
public class ConflictDetector {

    static final int LINE_BUFFER = 3;

    // @@ -start,count +start,count @@
    private static final Pattern HUNK_HEADER = Pattern.compile("^@@ -(\\d+)(?:,(\\d+))? \\+\\d+(?:,\\d+)? @@",
            Pattern.MULTILINE);

    private final GitProviderClient gitProviderClient;
    private final boolean lineLevel;

    public ConflictDetector(GitProviderClient gitProviderClient,
                            @Value("${mergeflow.queue.conflicts.line-level:false}") boolean lineLevel) {
        this.gitProviderClient = gitProviderClient;
        this.lineLevel = lineLevel;
    }

    /**
     * Compare a PR against the queued PRs ahead of it, fetching changed files from the provider.
     * The candidate's own file list is fetched once.
     */
    public List<FileOverlap> findOverlaps(String owner, String repo, MergeQueueItem candidate,
                                          List<MergeQueueItem> ahead) {
        if (ahead.isEmpty()) {
            return List.of();
        }
        List<PullRequestFile> candidateFiles = gitProviderClient.getPullRequestFiles(owner, repo, candidate.getPrNumber());

        Map<Integer, List<PullRequestFile>> aheadFiles = new LinkedHashMap<>();
        for (MergeQueueItem other : ahead) {
            aheadFiles.put(other.getPrNumber(), gitProviderClient.getPullRequestFiles(owner, repo, other.getPrNumber()));
        }
        return compare(candidateFiles, aheadFiles);
    }

    /**
     * @param aheadFiles changed files of the PRs ahead, keyed by PR number in queue order
     */
    public List<FileOverlap> compare(List<PullRequestFile> candidateFiles, Map<Integer, List<PullRequestFile>> aheadFiles) {
        Map<String, PullRequestFile> byName = index(candidateFiles);
        List<FileOverlap> overlaps = new ArrayList<>();

        for (Map.Entry<Integer, List<PullRequestFile>> entry : aheadFiles.entrySet()) {
            TreeSet<String> shared = new TreeSet<>();
            for (PullRequestFile other : entry.getValue()) {
                PullRequestFile mine = byName.get(other.getFilename());
                if (mine != null && conflicts(mine, other)) {
                    shared.add(other.getFilename());
                }
            }
            if (!shared.isEmpty()) {
                overlaps.add(new FileOverlap(entry.getKey(), new ArrayList<>(shared)));
            }
        }

        if (!overlaps.isEmpty()) {
            log.debug("Found overlaps with {} queued PR(s)", overlaps.size());
        }
        return overlaps;
    }

    private boolean conflicts(PullRequestFile mine, PullRequestFile other) {
        if (!lineLevel) {
            return true;
        }
        if (!mine.hasPatch() || !other.hasPatch()) {
            return true;
        }
        List<LineRange> mineRanges = parseHunks(mine.getPatch());
        List<LineRange> otherRanges = parseHunks(other.getPatch());
        for (LineRange a : mineRanges) {
            for (LineRange b : otherRanges) {
                if (a.overlaps(b, LINE_BUFFER)) {
                    return true;
                }
            }
        }
        return false;
    }

    static List<LineRange> parseHunks(String patch) {
        List<LineRange> ranges = new ArrayList<>();
        Matcher matcher = HUNK_HEADER.matcher(patch);
        while (matcher.find()) {
            int start = Integer.parseInt(matcher.group(1));
            int count = matcher.group(2) != null ? Integer.parseInt(matcher.group(2)) : 1;
            // Pure insertions touch no base lines; treat them as touching the insertion point
            int end = count > 0 ? start + count - 1 : start;
            ranges.add(new LineRange(start, end));
        }
        return ranges;
    }

    private static Map<String, PullRequestFile> index(List<PullRequestFile> files) {
        Map<String, PullRequestFile> byName = new HashMap<>();
        for (PullRequestFile file : files) {
            if (file.getFilename() != null) {
                byName.put(file.getFilename(), file);
            }
            // A rename still clashes with edits to the old path
            if (file.getPreviousFilename() != null) {
                byName.putIfAbsent(file.getPreviousFilename(), file);
            }
        }
        return byName;
    }
}
