package com.splitttr.wiki.service;

import com.splitttr.wiki.entity.BranchRecord;
import com.splitttr.wiki.entity.EditPermission;
import com.splitttr.wiki.entity.HistoryEntry;
import com.splitttr.wiki.entity.Page;
import com.splitttr.wiki.repository.BranchStore;
import com.splitttr.wiki.repository.EditStatsStore;
import com.splitttr.wiki.repository.HistoryStore;
import com.splitttr.wiki.repository.PageStore;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.bson.types.ObjectId;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.stream.Collectors;

/**
 * Branch-aware versioned content engine.
 *
 * <p>Every overwrite of a live page first archives the page into history. Multi-step
 * operations are a sequence of independent writes; only the first save of a title
 * (main + talk) is transactional.
 */
@ApplicationScoped
public class VersioningService {

    private static final Logger LOG = Logger.getLogger(VersioningService.class);

    private static final DateTimeFormatter TALK_STAMP =
        DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm").withZone(ZoneOffset.UTC);

    static final String FIRST_SAVE_SUMMARY = "Page created";
    static final String TALK_CREATED_SUMMARY = "Talk page created";

    @Inject PageStore pages;
    @Inject HistoryStore history;
    @Inject BranchStore branches;
    @Inject EditStatsStore editStats;
    @Inject Clock clock;

    @ConfigProperty(name = "wiki.history.max-versions", defaultValue = "100")
    int maxVersions;

    @ConfigProperty(name = "wiki.search.max-results", defaultValue = "100")
    int maxSearchResults;

    public enum RestoreOutcome { RESTORED, NO_OP }

    // ---- reads ----

    public Optional<Page> get(String title, String branch) {
        return pages.findPage(requireTitle(title), requireBranch(branch));
    }

    public List<Page> listPages(String branch, int limit) {
        return pages.listByBranch(requireBranch(branch), clamp(limit, maxSearchResults));
    }

    public List<Page> searchPages(String query, String branch, int limit) {
        if (query == null || query.isBlank()) {
            throw new BadRequestException("Search query cannot be empty");
        }
        String b = requireBranch(branch);
        List<Page> found = pages.search(query.strip(), b, clamp(limit, maxSearchResults));
        LOG.infof("Search performed: '%s' on branch '%s' - found %d results", query.strip(), b, found.size());
        return found;
    }

    // main first, then every other branch of the page in name order.
    public List<String> listBranches(String title) {
        String t = requireTitle(title);
        TreeSet<String> names = new TreeSet<>();
        branches.listForPage(t).forEach(r -> names.add(r.branchName));
        pages.listByTitle(t).forEach(p -> names.add(p.branch));
        return withMainFirst(names);
    }

    public List<String> listAllBranches() {
        return withMainFirst(new TreeSet<>(branches.listBranchNames()));
    }

    /**
     * Live page followed by archived versions, newest first, at most {@code limit} entries.
     */
    public List<PageVersion> listVersions(String title, String branch, int limit) {
        String t = requireTitle(title);
        String b = requireBranch(branch);
        Optional<Page> current = pages.findPage(t, b);
        int cap = clamp(limit, maxVersions);
        int total = 1 + (int) history.countVersions(t, b);

        List<PageVersion> versions = new ArrayList<>();
        current.ifPresent(p -> versions.add(versionOf(p, total)));
        int remaining = cap - versions.size();
        if (remaining > 0) {
            // history indexes start at 1 whether or not the live page still exists
            int index = 1;
            for (HistoryEntry entry : history.listNewestFirst(t, b, remaining)) {
                versions.add(versionOf(entry, index, total));
                index++;
            }
        }
        return versions;
    }

    // ---- writes ----

    /**
     * Creates a page on a branch. Talk content is signed before it is stored.
     */
    public Page create(String title, String content, String author, String branch, String summary) {
        String t = requireTitle(title);
        String b = requireBranch(branch);
        String who = PageNames.normalizeAuthor(author);
        if (pages.findPage(t, b).isPresent()) {
            throw new ConflictException("Page '" + t + "' already exists on branch '" + b + "'");
        }
        Page page = insertPage(t, content == null ? "" : content, who, b, PageNames.normalizeSummary(summary));
        LOG.infof("Page created: %s on branch: %s by %s", t, b, who);
        return page;
    }

    /**
     * Saves an edit. The first save of a title creates its main and talk pages together; a save
     * to a branch the title does not have yet starts that branch from the given content; any
     * other save archives the live page and overwrites it. Last write wins.
     */
    public Page update(String title, String content, String author, String branch, String summary,
                       EditPermission permission, Set<String> allowedUsers) {
        String t = requireTitle(title);
        String b = requireBranch(branch);
        String who = PageNames.normalizeAuthor(author);
        String body = content == null ? "" : content;
        String note = PageNames.normalizeSummary(summary);

        Page saved;
        if (!pages.existsAnyBranch(t)) {
            saved = createFirstRevision(t, body, who, b, note);
        } else {
            Optional<Page> existing = pages.findPage(t, b);
            if (existing.isEmpty()) {
                saved = insertPage(t, body, who, b, note);
                LOG.infof("Page created: %s on branch: %s by %s", t, b, who);
            } else {
                saved = overwrite(existing.get(), body, who, note, permission, allowedUsers);
                LOG.infof("Page updated: %s on branch: %s by %s", t, b, who);
            }
        }

        if (!EditPermission.ANONYMOUS.equals(who)) {
            editStats.recordEdit(who, t);
        }
        return saved;
    }

    /**
     * Starts {@code newBranch} as a copy of {@code sourceBranch}: the live page and every
     * history entry. A fork that stopped part-way is resumed by calling fork again with the
     * same arguments.
     */
    public Page fork(String title, String newBranch, String sourceBranch) {
        String t = requireTitle(title);
        if (!PageNames.isValidNewBranchName(newBranch)) {
            throw new BadRequestException("Invalid branch name");
        }
        String target = newBranch.strip();
        String source = requireBranch(sourceBranch);

        boolean targetLive = pages.findPage(t, target).isPresent();
        Optional<BranchRecord> record = branches.findRecord(t, target);
        boolean resuming = false;
        if (record.isPresent()) {
            // a registered branch without a page is a fork that never finished
            if (targetLive || !source.equals(record.get().createdFrom)) {
                throw new ConflictException("Branch '" + target + "' already exists for page '" + t + "'");
            }
            resuming = true;
        } else if (targetLive) {
            throw new ConflictException("Branch '" + target + "' already exists for page '" + t + "'");
        }

        Page sourcePage = pages.findPage(t, source)
            .orElseThrow(() -> new NotFoundException("Source page not found: " + t + " on branch: " + source));

        Instant now = clock.instant();
        if (resuming) {
            LOG.warnf("Resuming incomplete fork of %s from %s to %s", t, source, target);
        } else {
            branches.insert(BranchRecord.of(t, target, source, now));
        }

        try {
            int copied = copyHistory(t, source, target);
            // the page goes last: its presence marks the fork as complete
            Page copy = sourcePage.copyOnto(target, now);
            pages.insert(copy);
            LOG.infof("Branch created: %s for page: %s from branch: %s (%d history entries copied)",
                target, t, source, copied);
            return copy;
        } catch (RuntimeException e) {
            LOG.errorf(e, "Fork of %s from %s to %s stopped after registering the branch", t, source, target);
            throw new PartialFailureException(
                "Branch '" + target + "' of '" + t + "' is incomplete; repeat the fork to finish it", e);
        }
    }

    /**
     * Makes the version at {@code index} the live content again. Index 0 is the live page and
     * restoring it does nothing. Permissions on the live page are left as they are.
     */
    public RestoreOutcome restoreVersion(String title, String branch, int index, String restoredBy) {
        String t = requireTitle(title);
        String b = requireBranch(branch);
        if (index < 0) {
            throw new BadRequestException("Invalid version index: " + index);
        }
        if (index == 0) {
            LOG.infof("Attempt to restore current version (no action): %s v%d on branch: %s", t, index, b);
            return RestoreOutcome.NO_OP;
        }
        Page current = pages.findPage(t, b)
            .orElseThrow(() -> new NotFoundException("Page not found: " + t + " on branch: " + b));
        HistoryEntry target = history.findAt(t, b, index - 1)
            .orElseThrow(() -> new NotFoundException("Version not found: " + t + " v" + index + " on branch: " + b));

        String summary = target.editSummary == null || target.editSummary.isBlank()
            ? "Restored version " + index
            : target.editSummary;
        Instant now = clock.instant();

        history.append(HistoryEntry.archive(current, now));
        current.content = target.content;
        current.author = target.author == null ? EditPermission.ANONYMOUS : target.author;
        current.editSummary = PageNames.normalizeSummary(summary);
        current.updatedAt = now;
        writeAfterArchive(current, "restore");

        LOG.infof("Version restored: %s v%d on branch: %s by %s", t, index, b,
            PageNames.normalizeAuthor(restoredBy));
        return RestoreOutcome.RESTORED;
    }

    /**
     * Line diff from version {@code fromIndex} to version {@code toIndex}, in that order.
     */
    public VersionDiff compareVersions(String title, String branch, int fromIndex, int toIndex) {
        String t = requireTitle(title);
        String b = requireBranch(branch);
        Page current = pages.findPage(t, b)
            .orElseThrow(() -> new NotFoundException("Page not found: " + t + " on branch: " + b));
        int total = 1 + (int) history.countVersions(t, b);
        if (total < 2) {
            throw new BadRequestException("Not enough versions to compare.");
        }
        if (fromIndex == toIndex) {
            throw new BadRequestException("Select two different versions to compare.");
        }
        PageVersion from = resolveVersion(current, fromIndex, total)
            .orElseThrow(() -> new NotFoundException("Selected versions could not be found."));
        PageVersion to = resolveVersion(current, toIndex, total)
            .orElseThrow(() -> new NotFoundException("Selected versions could not be found."));
        return VersionDiff.between(from, to);
    }

    /**
     * Moves every page, history entry, registry entry and per-page edit counter of
     * {@code oldTitle} to {@code newTitle}.
     */
    public void rename(String oldTitle, String newTitle) {
        String from = requireTitle(oldTitle);
        String to = requireTitle(newTitle);
        if (from.equals(to)) return;
        if (!pages.existsAnyBranch(from)) {
            throw new NotFoundException("Page not found: " + from);
        }
        if (pages.existsAnyBranch(to)) {
            throw new ConflictException("A page named '" + to + "' already exists");
        }

        long movedPages = pages.renameTitle(from, to);
        try {
            long movedHistory = history.renameTitle(from, to);
            long movedBranches = branches.renamePage(from, to);
            editStats.movePageCounts(from, to);
            LOG.infof("Page renamed: %s -> %s (%d pages, %d history entries, %d branch records)",
                from, to, movedPages, movedHistory, movedBranches);
        } catch (RuntimeException e) {
            LOG.errorf(e, "Rename %s -> %s moved %d pages but did not finish", from, to, movedPages);
            throw new PartialFailureException("Rename of '" + from + "' to '" + to + "' is incomplete", e);
        }
    }

    // Deletes the page on every branch. History is kept.
    public void deletePage(String title) {
        String t = requireTitle(title);
        long removed = pages.deleteByTitle(t);
        if (removed == 0) {
            LOG.warnf("Page not found for deletion: %s", t);
            throw new NotFoundException("Page not found: " + t);
        }
        long records = branches.deleteForPage(t);
        LOG.infof("Page deleted (all branches): %s (%d pages, %d branch records removed)", t, removed, records);
    }

    // Deletes one branch of a page and its registry entry. History is kept.
    public void deleteBranch(String title, String branch) {
        String t = requireTitle(title);
        String b = requireBranch(branch);
        long removed = pages.deleteBranch(t, b);
        long records = branches.deleteRecord(t, b);
        if (records == 0 && !PageNames.isImplicitBranch(b)) {
            LOG.warnf("Branch record not found in branches collection: %s for page %s", b, t);
        }
        if (removed == 0) {
            throw new NotFoundException("Branch '" + b + "' not found for page '" + t + "'");
        }
        LOG.infof("Deleted %d page doc(s) and %d branch doc(s) for (%s, %s)", removed, records, t, b);
    }

    // ---- internals ----

    private Page createFirstRevision(String title, String body, String who, String requestedBranch, String note) {
        Instant now = clock.instant();
        Page main = newPage(title, PageNames.MAIN, body, who, note.isEmpty() ? FIRST_SAVE_SUMMARY : note, now);
        Page talk = newPage(title, PageNames.TALK, "", who, TALK_CREATED_SUMMARY, now);
        pages.insertPair(main, talk);
        LOG.infof("Page created: %s on branches main and talk by %s", title, who);
        return PageNames.TALK.equals(requestedBranch) ? talk : main;
    }

    private Page insertPage(String title, String body, String who, String branch, String note) {
        Instant now = clock.instant();
        String stored = PageNames.TALK.equals(branch) ? signTalkEntry(body, who, now) : body;
        Page page = newPage(title, branch, stored, who, note, now);
        if (!PageNames.isImplicitBranch(branch) && branches.findRecord(title, branch).isEmpty()) {
            branches.insert(BranchRecord.of(title, branch, null, now));
        }
        pages.insert(page);
        return page;
    }

    private Page overwrite(Page existing, String body, String who, String note,
                           EditPermission permission, Set<String> allowedUsers) {
        EditPermission gate = existing.editPermission == null ? EditPermission.EVERYBODY : existing.editPermission;
        long userEdits = EditPermission.ANONYMOUS.equals(who) ? 0L : editStats.totalEdits(who);
        if (!gate.canEdit(existing.allowedUsers, userEdits, who)) {
            LOG.warnf("Edit of %s on branch %s rejected for %s by permission %s", existing.title, existing.branch, who, gate);
            throw new ForbiddenException("You do not have permission to edit this page");
        }

        Instant now = clock.instant();
        history.append(HistoryEntry.archive(existing, now));

        if (PageNames.TALK.equals(existing.branch)) {
            existing.content = appendTalkEntry(existing.content, body, who, now);
        } else {
            existing.content = body;
        }
        existing.author = who;
        existing.editSummary = note;
        if (permission != null) {
            existing.editPermission = permission;
            existing.allowedUsers = allowedUsers == null ? new LinkedHashSet<>() : new LinkedHashSet<>(allowedUsers);
        } else if (allowedUsers != null) {
            existing.allowedUsers = new LinkedHashSet<>(allowedUsers);
        }
        existing.updatedAt = now;
        writeAfterArchive(existing, "update");
        return existing;
    }

    private void writeAfterArchive(Page page, String operation) {
        try {
            pages.replace(page);
        } catch (RuntimeException e) {
            LOG.errorf(e, "%s of %s on branch %s archived the old version but did not write the new one",
                operation, page.title, page.branch);
            throw new PartialFailureException(
                "History was archived but the page " + operation + " failed for '" + page.title + "'", e);
        }
    }

    // Rows already copied by an unfinished fork, or by a fork of a since-deleted branch, are skipped.
    private int copyHistory(String title, String source, String target) {
        Set<ObjectId> alreadyCopied = history.listAll(title, target).stream()
            .map(e -> e.sourceEntryId)
            .filter(Objects::nonNull)
            .collect(Collectors.toSet());
        int copied = 0;
        for (HistoryEntry entry : history.listAll(title, source)) {
            if (entry.id != null && alreadyCopied.contains(entry.id)) continue;
            history.append(entry.copyOnto(target));
            copied++;
        }
        return copied;
    }

    private Optional<PageVersion> resolveVersion(Page current, int index, int total) {
        if (index < 0) return Optional.empty();
        if (index == 0) return Optional.of(versionOf(current, total));
        return history.findAt(current.title, current.branch, index - 1)
            .map(entry -> versionOf(entry, index, total));
    }

    private static PageVersion versionOf(Page page, int total) {
        return new PageVersion(0, Math.max(1, total), page.author, page.updatedAt,
            page.editSummary == null ? "" : page.editSummary.strip(), page.content, true);
    }

    private static PageVersion versionOf(HistoryEntry entry, int index, int total) {
        return new PageVersion(index, Math.max(1, total - index),
            entry.author == null ? EditPermission.ANONYMOUS : entry.author, entry.updatedAt,
            entry.editSummary == null ? "" : entry.editSummary.strip(), entry.content, false);
    }

    private static Page newPage(String title, String branch, String content, String who, String note, Instant now) {
        Page page = new Page();
        page.title = title;
        page.branch = branch;
        page.content = content;
        page.author = who;
        page.editSummary = note;
        page.editPermission = EditPermission.EVERYBODY;
        page.allowedUsers = new LinkedHashSet<>();
        page.createdAt = now;
        page.updatedAt = now;
        return page;
    }

    static String signTalkEntry(String content, String author, Instant at) {
        String body = content == null ? "" : content.strip();
        String signature = "(User:" + author + " " + TALK_STAMP.format(at) + " UTC)";
        return body.isEmpty() ? signature : body + " " + signature;
    }

    static String appendTalkEntry(String previous, String content, String author, Instant at) {
        String signed = signTalkEntry(content, author, at);
        if (previous == null || previous.isBlank()) return signed;
        return previous.stripTrailing() + "\n\n" + signed;
    }

    private static List<String> withMainFirst(TreeSet<String> names) {
        names.remove(PageNames.MAIN);
        List<String> out = new ArrayList<>(names.size() + 1);
        out.add(PageNames.MAIN);
        out.addAll(names);
        return out;
    }

    private static String requireTitle(String title) {
        if (!PageNames.isValidTitle(title)) {
            throw new BadRequestException("Invalid page title");
        }
        return title;
    }

    private static String requireBranch(String branch) {
        String b = PageNames.normalizeBranch(branch);
        if (!PageNames.isSafeBranchName(b)) {
            throw new BadRequestException("Invalid branch name");
        }
        return b;
    }

    private static int clamp(int limit, int max) {
        return Math.min(Math.max(limit, 1), Math.max(max, 1));
    }

    public static class NotFoundException extends RuntimeException {
        public NotFoundException() { super(); }
        public NotFoundException(String message) { super(message); }
    }

    public static class ConflictException extends RuntimeException {
        public ConflictException(String message) { super(message); }
    }

    public static class BadRequestException extends RuntimeException {
        public BadRequestException(String message) { super(message); }
    }

    public static class ForbiddenException extends RuntimeException {
        public ForbiddenException(String message) { super(message); }
    }

    // A multi-step write stopped after some of its steps were applied.
    public static class PartialFailureException extends RuntimeException {
        public PartialFailureException(String message, Throwable cause) { super(message, cause); }
    }
}
