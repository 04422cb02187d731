package me.toymail.mailbox.store;

import me.toymail.mailbox.backend.CheckResult;
import me.toymail.mailbox.backend.MailboxBackend;
import me.toymail.mailbox.backend.MailboxData;
import me.toymail.mailbox.backend.MessageHandle;
import me.toymail.mailbox.notify.MailboxEvent;
import me.toymail.mailbox.notify.MailboxNotification;
import me.toymail.mailbox.notify.Notifier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.function.Predicate;

/**
 * One mail collection, independent of how it is stored.
 *
 * <p>The mailbox owns its emails (the real slots), a virtual view over them
 * (visible subset in display order), three cross-reference indices and the
 * private data of its backend. Emails are appended by the backend while it
 * opens or checks the mailbox; removal only happens in {@link #purge()}, which
 * rebuilds the view and every index in one step.
 *
 * <p>A mailbox is not synchronized. Callers serialize mutating calls
 * (append, flag changes, purge, view rebuilds, open/check/sync/close);
 * read-only calls may run together. Observers are called synchronously from
 * inside the mutating call.
 */
public final class Mailbox {
    private static final Logger log = LoggerFactory.getLogger(Mailbox.class);

    private static final Predicate<Email> ALL = e -> true;

    private final String path;
    private final String realPath;
    private String description;
    private boolean hidden;
    private boolean hasNew;
    private boolean notified;

    private MailboxType type = MailboxType.UNKNOWN;
    private MailboxBackend backend;
    private MailboxData data;

    private final MailboxFlags flags = new MailboxFlags();
    private AclRights rights = AclRights.ALL;
    private int opened;

    private Instant mtime;
    private Instant lastVisited;
    private Instant statsLastChecked;

    // counters, recomputed by updateStats()
    private long size;
    private int msgUnread;
    private int msgFlagged;
    private int msgNew;
    private int msgDeleted;
    private int msgTagged;
    private boolean statsDone;
    private boolean statsStale = true;
    private boolean checkStats = true;

    private final EmailArray emails = new EmailArray();
    private int[] v2r = new int[0];
    private int vcount;
    private Predicate<Email> viewFilter = ALL;
    private Comparator<Email> viewOrder = SortOrder.ORDER.comparator();

    private final SubjectNormalizer subjectNormalizer;
    private EmailIndex idIndex;
    private EmailIndex subjectIndex;
    private EmailIndex labelIndex;
    private boolean needsRebuild;
    private long appends;

    private final Notifier<MailboxEvent> notifier = new Notifier<>();

    public Mailbox(String path) {
        this(path, SubjectNormalizer.DEFAULT);
    }

    public Mailbox(String path, SubjectNormalizer subjectNormalizer) {
        if (path == null || path.isBlank()) {
            throw new IllegalArgumentException("Mailbox path cannot be empty");
        }
        this.path = path;
        this.realPath = canonicalPath(path);
        this.description = defaultDescription(path);
        this.subjectNormalizer = subjectNormalizer;
        this.idIndex = EmailIndex.byMessageId();
        this.subjectIndex = EmailIndex.bySubject(subjectNormalizer);
        this.labelIndex = EmailIndex.byLabel();
    }

    /**
     * Canonical form used to spot the same mailbox under two names.
     * URLs are kept as they are; local paths are made absolute and, when they
     * exist, resolved through symbolic links.
     */
    public static String canonicalPath(String path) {
        if (path.contains("://")) {
            return path;
        }
        Path p = Paths.get(path).toAbsolutePath().normalize();
        try {
            return p.toRealPath().toString();
        } catch (IOException e) {
            return p.toString();
        }
    }

    private static String defaultDescription(String path) {
        String trimmed = path.endsWith("/") ? path.substring(0, path.length() - 1) : path;
        int slash = trimmed.lastIndexOf('/');
        return slash >= 0 && slash < trimmed.length() - 1 ? trimmed.substring(slash + 1) : trimmed;
    }

    // ===== Identity =====

    public String getPath() { return path; }
    public String getRealPath() { return realPath; }

    public String getDescription() { return description; }
    public void setDescription(String description) { this.description = description; }

    public boolean isHidden() { return hidden; }
    public void setHidden(boolean hidden) { this.hidden = hidden; }

    public boolean hasNew() { return hasNew; }
    public void setHasNew(boolean hasNew) { this.hasNew = hasNew; }

    public boolean isNotified() { return notified; }
    public void setNotified(boolean notified) { this.notified = notified; }

    public MailboxFlags flags() { return flags; }

    public Instant getMtime() { return mtime; }
    public void setMtime(Instant mtime) { this.mtime = mtime; }
    public Instant getLastVisited() { return lastVisited; }
    public Instant getStatsLastChecked() { return statsLastChecked; }

    public boolean isCheckStats() { return checkStats; }
    public void setCheckStats(boolean checkStats) { this.checkStats = checkStats; }

    public Notifier<MailboxEvent> notifier() {
        return notifier;
    }

    /**
     * Announces a change to every observer of this mailbox.
     */
    public void changed(MailboxNotification type) {
        log.debug("{}: {}", path, type);
        notifier.notify(new MailboxEvent(this, type));
    }

    // ===== Rights =====

    public AclRights getRights() { return rights; }

    public void setRights(AclRights rights) {
        if (rights == null) {
            throw new IllegalArgumentException("Rights cannot be null");
        }
        this.rights = rights;
    }

    public boolean hasRight(AclRight right) {
        return rights.has(right);
    }

    private void requireRight(String operation, AclRight right) throws PermissionDeniedException {
        if (!rights.has(right)) {
            throw new PermissionDeniedException(path, operation, right);
        }
    }

    private void requireWritable(String operation) throws PermissionDeniedException {
        if (flags.isReadOnly()) {
            throw new PermissionDeniedException(path, operation, null);
        }
    }

    // ===== Backend binding =====

    public MailboxType getType() { return type; }

    public MailboxBackend getBackend() { return backend; }

    /**
     * Binds the mailbox to its backend. A mailbox is bound exactly once.
     */
    public void attach(MailboxBackend backend) {
        if (backend == null) {
            throw new IllegalArgumentException("Backend cannot be null");
        }
        if (this.backend != null) {
            throw new IllegalStateException("Mailbox " + path + " is already bound to " + type);
        }
        if (!backend.type().isBindable()) {
            throw new IllegalArgumentException("Cannot bind a mailbox to " + backend.type());
        }
        this.backend = backend;
        this.type = backend.type();
    }

    /**
     * Stores the backend's private data. The mailbox owns it from now on and
     * frees it exactly once.
     */
    public void setData(MailboxData data) {
        if (data == null) {
            throw new IllegalArgumentException("Backend data cannot be null; use releaseData()");
        }
        if (this.data != null) {
            throw new IllegalStateException("Mailbox " + path + " already holds backend data");
        }
        this.data = data;
    }

    public boolean hasData() {
        return data != null;
    }

    /**
     * @return the backend data, or null if there is none
     * @throws InconsistentStateException if the data is of another type
     */
    public <T extends MailboxData> T getData(Class<T> cls) {
        if (data == null) {
            return null;
        }
        if (!cls.isInstance(data)) {
            throw new InconsistentStateException("Mailbox " + path + " holds " + data.getClass().getSimpleName()
                    + ", not " + cls.getSimpleName());
        }
        return cls.cast(data);
    }

    /**
     * Frees the backend data if present. Safe to call any number of times.
     */
    public void releaseData() {
        MailboxData d = data;
        if (d == null) {
            return;
        }
        data = null;
        d.free();
        log.debug("Released backend data of {}", path);
    }

    // ===== Lifecycle =====

    public boolean isOpen() {
        return opened > 0;
    }

    public int getOpenCount() {
        return opened;
    }

    /**
     * Opens the mailbox through its backend, or just counts a nested open.
     */
    public void open() throws BackendException {
        if (backend == null) {
            throw new IllegalStateException("No backend bound to " + path);
        }
        if (opened > 0) {
            opened++;
            log.debug("Nested open of {} (count {})", path, opened);
            return;
        }
        boolean ok = false;
        try {
            backend.open(this);
            ok = true;
        } catch (InconsistentStateException e) {
            throw e;
        } catch (Exception e) {
            throw wrap("open", e);
        } finally {
            if (!ok) {
                releaseData();
                clearContents();
            }
        }
        opened = 1;
        rebuildIndices();
        rebuildView(ALL, SortOrder.ORDER.comparator());
        if (checkStats) {
            updateStats();
        }
        log.info("Opened {} {} ({} messages)", type, path, emails.size());
    }

    /**
     * Asks the backend for outside changes.
     */
    public CheckResult check() throws BackendException {
        requireOpen("check");
        long appendsBefore = appends;
        CheckResult result;
        try {
            result = backend.check(this);
        } catch (InconsistentStateException e) {
            throw e;
        } catch (Exception e) {
            throw wrap("check", e);
        }
        switch (result) {
            case NEW_MAIL:
                hasNew = true;
                rebuildView();
                statsStale = true;
                changed(MailboxNotification.UPDATE);
                break;
            case REOPENED:
                // removals and arrivals can come in the same check
                if (appends > appendsBefore) {
                    hasNew = true;
                }
                rebuildIndices();
                rebuildView();
                statsStale = true;
                changed(MailboxNotification.UPDATE);
                break;
            case FLAGS:
                statsStale = true;
                changed(MailboxNotification.RESORT);
                break;
            default:
                break;
        }
        return result;
    }

    /**
     * Writes changes back through the backend and purges deleted emails.
     *
     * @return the number of emails purged
     */
    public int sync() throws MailboxException {
        return sync(true);
    }

    /**
     * Writes changes back through the backend. Without {@code expunge} only
     * flags are written: deleted emails stay in storage and in the slots.
     *
     * @return the number of emails purged
     */
    public int sync(boolean expunge) throws MailboxException {
        requireOpen("sync");
        int deleted = expunge ? countDeleted() : 0;
        if (!flags.isChanged() && deleted == 0) {
            return 0;
        }
        if (flags.isReadOnly() || flags.isDontWrite()) {
            throw new PermissionDeniedException(path, "sync", null);
        }
        if (deleted > 0) {
            requireRight("sync", AclRight.EXPUNGE);
        }
        try {
            backend.sync(this, expunge);
        } catch (InconsistentStateException e) {
            throw e;
        } catch (Exception e) {
            throw wrap("sync", e);
        }
        int purged = expunge ? purge() : 0;
        flags.setChanged(false);
        log.info("Synced {} ({} purged)", path, purged);
        return purged;
    }

    /**
     * Closes one level of opening. The last close calls the backend, frees its
     * data and drops the emails; closing a closed mailbox does nothing.
     *
     * @return true if the mailbox is now fully closed by this call
     */
    public boolean close() throws BackendException {
        if (opened == 0) {
            log.debug("Close of {} ignored, not open", path);
            return false;
        }
        if (opened > 1) {
            opened--;
            log.debug("Nested close of {} (count {})", path, opened);
            return false;
        }
        BackendException failure = null;
        try {
            backend.close(this);
        } catch (InconsistentStateException e) {
            throw e;
        } catch (Exception e) {
            failure = wrap("close", e);
        } finally {
            releaseData();
            clearContents();
            opened = 0;
            lastVisited = Instant.now();
            changed(MailboxNotification.CLOSED);
        }
        if (failure != null) {
            throw failure;
        }
        log.info("Closed {}", path);
        return true;
    }

    /**
     * Final teardown: closes the mailbox if open, frees backend data and drops
     * the emails. Idempotent.
     */
    public void dispose() {
        if (opened > 0) {
            opened = 1;
            try {
                close();
            } catch (BackendException e) {
                log.warn("Close failed while disposing {}: {}", path, e.getMessage());
            }
        }
        releaseData();
        clearContents();
    }

    private void requireOpen(String operation) {
        if (opened == 0) {
            throw new IllegalStateException("Cannot " + operation + " " + path + ": mailbox is not open");
        }
    }

    private BackendException wrap(String operation, Exception e) {
        if (e instanceof BackendException) {
            return (BackendException) e;
        }
        String detail = e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
        log.debug("Backend {} failed on {}: {}", operation, path, detail);
        return new BackendException(path, operation, detail, e);
    }

    private void clearContents() {
        for (int i = 0; i < emails.size(); i++) {
            Email e = emails.get(i);
            e.setIndex(-1);
            e.setVnum(-1);
        }
        idIndex.clear();
        subjectIndex.clear();
        labelIndex.clear();
        emails.clear();
        v2r = new int[0];
        vcount = 0;
        statsStale = true;
        statsDone = false;
    }

    // ===== Messages =====

    public MessageHandle openMessage(Email email) throws MailboxException {
        requireOpen("read a message in");
        requireOwned(email);
        requireRight("msg-open", AclRight.READ);
        try {
            return backend.openMessage(this, email);
        } catch (InconsistentStateException e) {
            throw e;
        } catch (Exception e) {
            throw wrap("msg-open", e);
        }
    }

    public MessageHandle openNewMessage(Email template) throws MailboxException {
        requireOpen("add a message to");
        requireWritable("msg-open-new");
        requireRight("msg-open-new", AclRight.INSERT);
        try {
            return backend.openNewMessage(this, template);
        } catch (InconsistentStateException e) {
            throw e;
        } catch (Exception e) {
            throw wrap("msg-open-new", e);
        }
    }

    /**
     * Finishes a new message. The resulting email is appended to the slots and
     * indices but only becomes visible with the next view rebuild.
     */
    public Email commitMessage(MessageHandle handle) throws MailboxException {
        requireOpen("commit a message to");
        requireRight("msg-commit", AclRight.INSERT);
        if (!handle.isWritable()) {
            throw new IllegalArgumentException("Only new messages can be committed");
        }
        try {
            return backend.commitMessage(this, handle);
        } catch (InconsistentStateException e) {
            throw e;
        } catch (Exception e) {
            throw wrap("msg-commit", e);
        }
    }

    // ===== Record store =====

    /**
     * Appends an email to the slots and the indices. The virtual view is left
     * alone: every entry stays valid and the new email shows up at the next
     * {@link #rebuildView}.
     *
     * @return the real index of the email
     */
    public int append(Email email) {
        if (email == null) {
            throw new IllegalArgumentException("Email cannot be null");
        }
        if (email.getIndex() >= 0) {
            throw new IllegalArgumentException("Email already belongs to a mailbox: " + email);
        }
        int index = emails.add(email);
        appends++;
        if (!needsRebuild) {
            idIndex.add(email);
            subjectIndex.add(email);
            labelIndex.add(email);
        }
        statsStale = true;
        return index;
    }

    /**
     * Number of emails in the real slots, including deleted ones not yet purged.
     */
    public int getMessageCount() {
        return emails.size();
    }

    /**
     * Number of emails in the virtual view.
     */
    public int getVirtualCount() {
        return vcount;
    }

    public int getCapacity() {
        return emails.capacity();
    }

    /**
     * @throws IndexOutOfBoundsException if there is no such slot
     */
    public Email getEmail(int index) {
        return emails.get(index);
    }

    /**
     * Email at a position of the virtual view.
     *
     * @throws IndexOutOfBoundsException if the position is outside the view
     */
    public Email getVirtualEmail(int vnum) {
        if (vnum < 0 || vnum >= vcount) {
            throw new IndexOutOfBoundsException("Virtual number " + vnum + " out of range 0.." + vcount);
        }
        int real = v2r[vnum];
        if (real >= emails.size()) {
            throw new InconsistentStateException("View entry " + vnum + " points at slot " + real
                    + " past the end of " + path + " (" + emails.size() + " emails)");
        }
        return emails.get(real);
    }

    /**
     * @return the real index behind a virtual position
     */
    public int virtualToReal(int vnum) {
        return getVirtualEmail(vnum).getIndex();
    }

    /**
     * Snapshot of all emails in slot order.
     */
    public List<Email> emails() {
        List<Email> list = new ArrayList<>(emails.size());
        for (int i = 0; i < emails.size(); i++) {
            list.add(emails.get(i));
        }
        return Collections.unmodifiableList(list);
    }

    /**
     * Snapshot of the virtual view in display order.
     */
    public List<Email> view() {
        List<Email> list = new ArrayList<>(vcount);
        for (int v = 0; v < vcount; v++) {
            list.add(getVirtualEmail(v));
        }
        return Collections.unmodifiableList(list);
    }

    /**
     * Recomputes the virtual view: the emails accepted by the filter, ordered
     * by the comparator with ties kept in slot order. The filter and order
     * are remembered for later rebuilds.
     */
    public void rebuildView(Predicate<Email> filter, Comparator<Email> order) {
        Predicate<Email> f = filter != null ? filter : ALL;
        Comparator<Email> o = (order != null ? order : SortOrder.ORDER.comparator())
                .thenComparingInt(Email::getIndex);

        Email[] visible = new Email[emails.size()];
        int n = 0;
        for (int i = 0; i < emails.size(); i++) {
            Email e = emails.get(i);
            e.setVnum(-1);
            if (f.test(e)) {
                visible[n++] = e;
            }
        }
        Arrays.sort(visible, 0, n, o);

        int[] map = new int[n];
        for (int v = 0; v < n; v++) {
            map[v] = visible[v].getIndex();
            visible[v].setVnum(v);
        }
        this.v2r = map;
        this.vcount = n;
        this.viewFilter = f;
        this.viewOrder = order != null ? order : SortOrder.ORDER.comparator();
        log.debug("Rebuilt view of {}: {} of {} visible", path, n, emails.size());
    }

    /**
     * Rebuilds the view with the filter and order used last time.
     */
    public void rebuildView() {
        rebuildView(viewFilter, viewOrder);
    }

    public void sort(SortOrder order, boolean reverse) {
        rebuildView(viewFilter, order.comparator(reverse));
    }

    /**
     * Marks the email in a slot as deleted. It stays in the slots until purged.
     */
    public void markDeleted(int index) throws PermissionDeniedException {
        setFlag(emails.get(index), EmailFlag.DELETED, true);
    }

    public void undelete(int index) throws PermissionDeniedException {
        setFlag(emails.get(index), EmailFlag.DELETED, false);
    }

    /**
     * Changes a flag of one of this mailbox's emails, subject to the rights
     * mask. TAGGED is local state and always allowed; everything else needs a
     * writable mailbox and the flag's right. Marking an email SEEN also clears NEW.
     *
     * @return true if anything changed
     */
    public boolean setFlag(Email email, EmailFlag flag, boolean on) throws PermissionDeniedException {
        requireOwned(email);
        if (flag.requiredRight() != null) {
            requireWritable("set " + flag);
            requireRight("set " + flag, flag.requiredRight());
        }
        boolean changed = email.applyFlag(flag, on);
        if (flag == EmailFlag.SEEN && on) {
            changed |= email.applyFlag(EmailFlag.NEW, false);
        }
        if (!changed) {
            return false;
        }
        if (flag != EmailFlag.TAGGED) {
            flags.setChanged(true);
        }
        statsStale = true;
        if (flag.affectsSort()) {
            changed(MailboxNotification.RESORT);
        }
        return true;
    }

    /**
     * Records a flag state reported by the backend. No access check, and the
     * mailbox is not marked changed since storage already has this state.
     */
    public boolean refreshFlag(Email email, EmailFlag flag, boolean on) {
        requireOwned(email);
        boolean changed = email.applyFlag(flag, on);
        if (changed) {
            statsStale = true;
        }
        return changed;
    }

    /**
     * Clears TAGGED on every email.
     *
     * @return the number of emails untagged
     */
    public int untagAll() {
        int n = 0;
        for (int i = 0; i < emails.size(); i++) {
            if (emails.get(i).applyFlag(EmailFlag.TAGGED, false)) {
                n++;
            }
        }
        statsStale = true;
        changed(MailboxNotification.UNTAG);
        return n;
    }

    private void requireOwned(Email email) {
        int i = email.getIndex();
        if (i < 0 || i >= emails.size() || emails.get(i) != email) {
            throw new IllegalArgumentException("Email does not belong to " + path + ": " + email);
        }
    }

    private int countDeleted() {
        int n = 0;
        for (int i = 0; i < emails.size(); i++) {
            if (emails.get(i).isDeleted()) n++;
        }
        return n;
    }

    /**
     * Removes every deleted email from the slots, compacts them, and rebuilds
     * the three indices and the virtual view together. Observers get one
     * INVALID event. If the rebuild fails the mailbox is left empty-viewed and
     * flagged as needing a full rebuild.
     *
     * @return the number of emails removed
     * @throws InconsistentStateException if the indices or view could not be rebuilt
     */
    public int purge() {
        return purge(Email::isDeleted);
    }

    /**
     * Like {@link #purge()}, but removes the emails matching the predicate.
     * Backends use this to drop records whose messages vanished from storage.
     */
    public int purge(Predicate<Email> remove) {
        Email[] removed = emails.compact(remove);
        for (Email e : removed) {
            e.setIndex(-1);
            e.setVnum(-1);
        }
        try {
            rebuildIndices();
            rebuildView();
        } catch (RuntimeException e) {
            needsRebuild = true;
            idIndex.clear();
            subjectIndex.clear();
            labelIndex.clear();
            for (int i = 0; i < emails.size(); i++) {
                emails.get(i).setVnum(-1);
            }
            v2r = new int[0];
            vcount = 0;
            if (e instanceof InconsistentStateException) {
                throw e;
            }
            throw new InconsistentStateException("Rebuild after purge failed on " + path, e);
        } finally {
            statsStale = true;
            changed(MailboxNotification.INVALID);
        }
        if (removed.length > 0) {
            log.info("Purged {} messages from {}", removed.length, path);
        }
        return removed.length;
    }

    /**
     * Rebuilds the three indices from the slots. All three are swapped in
     * together; on failure the old ones are discarded and the mailbox is
     * flagged as needing a full rebuild.
     */
    public void rebuildIndices() {
        EmailIndex ids = EmailIndex.byMessageId();
        EmailIndex subjects = EmailIndex.bySubject(subjectNormalizer);
        EmailIndex labels = EmailIndex.byLabel();
        try {
            for (int i = 0; i < emails.size(); i++) {
                Email e = emails.get(i);
                ids.add(e);
                subjects.add(e);
                labels.add(e);
            }
        } catch (RuntimeException e) {
            needsRebuild = true;
            idIndex.clear();
            subjectIndex.clear();
            labelIndex.clear();
            throw new InconsistentStateException("Index rebuild failed on " + path, e);
        }
        idIndex = ids;
        subjectIndex = subjects;
        labelIndex = labels;
        needsRebuild = false;
    }

    /**
     * @return true if a failed rebuild left the indices or view unusable
     */
    public boolean needsRebuild() {
        return needsRebuild;
    }

    // ===== Cross-reference lookups =====

    public Optional<Email> findById(String messageId) {
        requireIndices();
        String key = EmailIndex.normalizeId(messageId);
        return key == null ? Optional.empty() : idIndex.find(key);
    }

    /**
     * Emails whose normalized subject equals that of the given raw subject,
     * in insertion order.
     */
    public List<Email> findBySubject(String subject) {
        requireIndices();
        return subjectIndex.findAll(subjectNormalizer.normalize(subject));
    }

    public List<Email> findByLabel(String label) {
        requireIndices();
        return label == null ? List.of() : labelIndex.findAll(label.trim());
    }

    public EmailIndex idIndex() { return idIndex; }
    public EmailIndex subjectIndex() { return subjectIndex; }
    public EmailIndex labelIndex() { return labelIndex; }

    private void requireIndices() {
        if (needsRebuild) {
            throw new InconsistentStateException("Indices of " + path + " need a full rebuild");
        }
    }

    // ===== Counters =====

    /**
     * Recounts every counter from the slots.
     */
    public void updateStats() {
        long total = 0;
        int unread = 0, flagged = 0, fresh = 0, deleted = 0, tagged = 0;
        for (int i = 0; i < emails.size(); i++) {
            Email e = emails.get(i);
            total += e.getSize();
            if (!e.has(EmailFlag.SEEN)) unread++;
            if (e.has(EmailFlag.FLAGGED)) flagged++;
            if (e.has(EmailFlag.NEW)) fresh++;
            if (e.isDeleted()) deleted++;
            if (e.has(EmailFlag.TAGGED)) tagged++;
        }
        size = total;
        msgUnread = unread;
        msgFlagged = flagged;
        msgNew = fresh;
        msgDeleted = deleted;
        msgTagged = tagged;
        statsStale = false;
        statsDone = true;
        statsLastChecked = Instant.now();
    }

    private void ensureStats() {
        if (statsStale) {
            updateStats();
        }
    }

    /**
     * @return true once the counters have been computed at least once
     */
    public boolean isStatsDone() { return statsDone; }

    public long getSize() { ensureStats(); return size; }
    public int getUnreadCount() { ensureStats(); return msgUnread; }
    public int getFlaggedCount() { ensureStats(); return msgFlagged; }
    public int getNewCount() { ensureStats(); return msgNew; }
    public int getDeletedCount() { ensureStats(); return msgDeleted; }
    public int getTaggedCount() { ensureStats(); return msgTagged; }

    @Override
    public String toString() {
        return "Mailbox[" + type + ", " + path + ", " + emails.size() + " emails, open=" + opened + "]";
    }
}
