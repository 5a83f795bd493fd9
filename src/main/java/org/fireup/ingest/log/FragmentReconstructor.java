package org.fireup.ingest.log;

import java.io.ByteArrayOutputStream;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Reassembles logical payloads from the ordered stream of records of a log file.
 * <p>
 * A logical payload is either a single {@link RecordType#FULL} record or a
 * {@code FIRST, MIDDLE*, LAST} sequence whose payloads are concatenated in arrival order.
 * Records must be fed in file order: block order, then in-block order.
 * <p>
 * <b>State machine:</b> the reconstructor is either idle or accumulating the pieces of one open
 * fragment.
 * <ul>
 *   <li>{@code FULL} drops an open fragment (with a warning) and completes immediately.</li>
 *   <li>{@code FIRST} drops an open fragment (with a warning) and opens a new one.</li>
 *   <li>{@code MIDDLE} appends to the open fragment.</li>
 *   <li>{@code LAST} appends to the open fragment and completes it.</li>
 *   <li>{@code MIDDLE} or {@code LAST} while idle throws {@link LogStructureException}.</li>
 * </ul>
 * A fragment still open when {@link #finish()} is called is dropped with a warning.
 * <p>
 * Not thread-safe; one instance per parse.
 */
public class FragmentReconstructor {

    private static final Logger log = LoggerFactory.getLogger(FragmentReconstructor.class);

    private final List<byte[]> pieces = new ArrayList<>();
    private boolean accumulating;
    private RawRecord fragmentStart;
    private long completedRecords;
    private long droppedFragments;

    /**
     * Feeds the next record.
     *
     * @param record the next record in file order
     * @return the completed logical payload, or empty if the record only extended a fragment
     * @throws LogStructureException if a continuation record arrives while no fragment is open
     */
    public Optional<byte[]> accept(RawRecord record) throws LogStructureException {
        switch (record.type()) {
            case FULL -> {
                if (accumulating) {
                    dropOpenFragment("FULL record at block " + record.blockIndex() + ", offset " + record.offset());
                }
                completedRecords++;
                return Optional.of(record.payload());
            }
            case FIRST -> {
                if (accumulating) {
                    dropOpenFragment("FIRST record at block " + record.blockIndex() + ", offset " + record.offset());
                }
                accumulating = true;
                fragmentStart = record;
                pieces.add(record.payload());
                return Optional.empty();
            }
            case MIDDLE -> {
                requireOpenFragment(record);
                pieces.add(record.payload());
                return Optional.empty();
            }
            case LAST -> {
                requireOpenFragment(record);
                pieces.add(record.payload());
                byte[] assembled = concatenate(pieces);
                reset();
                completedRecords++;
                return Optional.of(assembled);
            }
            default -> throw new IllegalStateException("Unhandled record type: " + record.type());
        }
    }

    /**
     * Signals the end of the record stream. An open fragment means the file ended mid-sequence;
     * it is logged and dropped.
     *
     * @return {@code true} if an open fragment was dropped
     */
    public boolean finish() {
        if (!accumulating) {
            return false;
        }
        dropOpenFragment("end of file");
        return true;
    }

    public boolean hasOpenFragment() {
        return accumulating;
    }

    public long completedRecords() {
        return completedRecords;
    }

    public long droppedFragments() {
        return droppedFragments;
    }

    private void requireOpenFragment(RawRecord record) throws LogStructureException {
        if (!accumulating) {
            throw new LogStructureException(record.type(), record.blockIndex(), record.offset());
        }
    }

    private void dropOpenFragment(String reason) {
        log.warn("Dropping incomplete fragment of {} piece(s) started at block {}, offset {}: interrupted by {}",
            pieces.size(), fragmentStart.blockIndex(), fragmentStart.offset(), reason);
        droppedFragments++;
        reset();
    }

    private void reset() {
        pieces.clear();
        accumulating = false;
        fragmentStart = null;
    }

    private static byte[] concatenate(List<byte[]> parts) {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        for (byte[] part : parts) {
            out.writeBytes(part);
        }
        return out.toByteArray();
    }
}
