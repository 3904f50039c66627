package org.netpreserve.evidence;

import org.netpreserve.evidence.config.ArchiveConfig;

import java.io.PrintStream;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Renders workflow results, either as a plain list of Wayback URLs or as a Markdown report. Both mark posts that
 * could not be resolved explicitly so they can't be mistaken for posts with no evidence.
 */
public class Report {
    static final String UNRESOLVED = "UNRESOLVED";
    static final String CANCELLED = "CANCELLED";
    private static final DateTimeFormatter DATE = DateTimeFormatter.ofPattern("d MMMM uuuu", Locale.ENGLISH)
            .withZone(ZoneOffset.UTC);
    private final ArchiveConfig archive;

    public Report(ArchiveConfig archive) {
        this.archive = archive;
    }

    /**
     * One Wayback URL per retrieved-or-retrievable capture of a deleted (or unchecked) post, then a marker line per
     * post that couldn't be resolved.
     */
    public void writeList(List<PostDeletionResult> results, PrintStream out) {
        for (PostDeletionResult result : results) {
            if (result.resolution().wantsDownload()) {
                CaptureReference capture = result.earliestCapture();
                out.println(archive.viewUrl(capture.waybackTimestamp(), capture.url()));
            }
        }
        for (PostDeletionResult result : results) {
            if (result.resolution() == Resolution.FAILED) {
                out.println(UNRESOLVED + " " + result.postId() + " " + result.error());
            } else if (result.resolution() == Resolution.CANCELLED) {
                out.println(CANCELLED + " " + result.postId());
            }
        }
    }

    public String markdown(String subject, List<PostDeletionResult> results) {
        var deleted = new ArrayList<PostDeletionResult>();
        var unchecked = new ArrayList<PostDeletionResult>();
        var extant = new ArrayList<PostDeletionResult>();
        var noEvidence = new ArrayList<PostDeletionResult>();
        var failed = new ArrayList<PostDeletionResult>();
        var cancelled = new ArrayList<PostDeletionResult>();
        for (PostDeletionResult result : results) {
            switch (result.resolution()) {
                case DELETED_WITH_EVIDENCE -> deleted.add(result);
                case UNCHECKED_WITH_EVIDENCE -> unchecked.add(result);
                case EXTANT_WITH_EVIDENCE -> extant.add(result);
                case NO_EVIDENCE -> noEvidence.add(result);
                case FAILED -> failed.add(result);
                case CANCELLED -> cancelled.add(result);
            }
        }

        var sb = new StringBuilder();
        sb.append("# Deleted posts: ").append(subject).append("\n\n");
        sb.append(String.format(Locale.ROOT,
                "%d deleted with archived evidence, %d still live, %d not checked, %d without captures, "
                + "%d unresolved.%n%n",
                deleted.size(), extant.size(), unchecked.size(), noEvidence.size(), failed.size()));

        section(sb, "Deleted", deleted, true);
        section(sb, "Not checked", unchecked, true);
        section(sb, "Still live", extant, false);

        if (!noEvidence.isEmpty()) {
            sb.append("## No archived captures\n\n");
            for (PostDeletionResult result : noEvidence) {
                sb.append("* [").append(result.postId()).append("](").append(result.postId().url()).append(")\n");
            }
            sb.append('\n');
        }
        if (!failed.isEmpty()) {
            sb.append("## Unresolved\n\n");
            for (PostDeletionResult result : failed) {
                sb.append("* ").append(result.postId()).append(": **").append(UNRESOLVED).append("** ")
                        .append(escape(String.valueOf(result.error()))).append('\n');
            }
            sb.append('\n');
        }
        if (!cancelled.isEmpty()) {
            sb.append("## Cancelled\n\n");
            for (PostDeletionResult result : cancelled) {
                sb.append("* ").append(result.postId()).append('\n');
            }
            sb.append('\n');
        }
        return sb.toString();
    }

    private void section(StringBuilder sb, String heading, List<PostDeletionResult> results, boolean withEvidence) {
        if (results.isEmpty()) return;
        sb.append("## ").append(heading).append("\n\n");
        for (PostDeletionResult result : results) {
            CaptureReference capture = result.earliestCapture();
            sb.append("* [").append(DATE.format(capture.timestamp())).append("](")
                    .append(archive.viewUrl(capture.waybackTimestamp(), capture.url())).append(") ([live](")
                    .append(result.postId().url()).append(")) ")
                    .append(result.postId()).append(", ")
                    .append(result.captures().size()).append(result.captures().size() == 1 ? " capture" : " captures");
            if (withEvidence) {
                for (DownloadResult download : result.downloads()) {
                    switch (download.status()) {
                        case STORED, CACHED -> sb.append(", stored as `").append(download.digest()).append('`');
                        case FAILED -> sb.append(", **retrieval failed**: ").append(escape(download.error()));
                        case CANCELLED -> sb.append(", retrieval cancelled");
                    }
                }
            }
            sb.append('\n');
        }
        sb.append('\n');
    }

    static String escape(String text) {
        if (text == null) return "";
        return text.replace("\\", "\\\\").replace("*", "\\*").replace("_", "\\_")
                .replace("[", "\\[").replace("]", "\\]").replace("\n", " ");
    }
}
