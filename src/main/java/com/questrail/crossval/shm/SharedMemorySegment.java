package com.questrail.crossval.shm;

import com.questrail.crossval.api.Fingerprint;
import com.questrail.crossval.api.Participant;
import com.questrail.crossval.api.SetupException;
import com.questrail.crossval.barrier.Arrival;
import com.questrail.crossval.barrier.BarrierRound;
import com.questrail.crossval.config.ValidationTimingPolicy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.Closeable;
import java.io.IOException;
import java.io.RandomAccessFile;
import java.nio.MappedByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.channels.FileLock;
import java.nio.channels.OverlappingFileLockException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/**
 * SharedMemorySegment
 * =============================================================================
 * A memory-mapped file shared by every instance on one host, holding the
 * single live barrier round.
 *
 * <h2>Layout (big-endian, {@value #SEGMENT_SIZE} bytes)</h2>
 * <pre>
 *   offset  size  field
 *   ------  ----  -----------------------------------------
 *        0     4  magic 0x43565348
 *        4     4  instance count
 *        8     4  current sync point (-1 idle)
 *       12     4  instances arrived
 *       16     4  validation failed flag
 *       20     4  reserved
 *       24    16  instance ids [4]
 *       40  1024  fingerprints [4][256], UTF-8, NUL padded
 *     1064   512  mismatch detail, UTF-8, NUL padded
 * </pre>
 *
 * <h2>Mutual exclusion</h2>
 * Readers and writers of the round hold an OS file lock over the segment.
 * {@link #tryLock()} makes exactly one non-blocking attempt.
 *
 * <p>Instance 0 {@linkplain #create creates} and initialises the segment;
 * the others {@linkplain #open open} it, retrying until it is initialised.</p>
 */
public final class SharedMemorySegment implements Closeable
{
    private static final Logger log = LoggerFactory.getLogger(SharedMemorySegment.class);

    static final int MAGIC = 0x43565348;

    static final int MAGIC_OFFSET = 0;
    static final int COUNT_OFFSET = 4;
    static final int SYNC_POINT_OFFSET = 8;
    static final int ARRIVED_OFFSET = 12;
    static final int FAILED_OFFSET = 16;
    static final int IDS_OFFSET = 24;
    static final int FINGERPRINTS_OFFSET = IDS_OFFSET + 4 * Participant.MAX_INSTANCES;
    static final int FINGERPRINT_SLOT_SIZE = 256;
    static final int DETAIL_OFFSET = FINGERPRINTS_OFFSET + FINGERPRINT_SLOT_SIZE * Participant.MAX_INSTANCES;
    static final int DETAIL_SIZE = 512;

    public static final int SEGMENT_SIZE = DETAIL_OFFSET + DETAIL_SIZE;

    private final Path path;
    private final RandomAccessFile file;
    private final FileChannel channel;
    private final MappedByteBuffer map;
    private final int instanceCount;

    private SharedMemorySegment(Path path, RandomAccessFile file, MappedByteBuffer map, int instanceCount)
    {
        this.path = path;
        this.file = file;
        this.channel = file.getChannel();
        this.map = map;
        this.instanceCount = instanceCount;
    }

    /**
     * Creates (or reinitialises) the segment at {@code path} with an idle round.
     */
    public static SharedMemorySegment create(Path path, int instanceCount) throws SetupException
    {
        Objects.requireNonNull(path, "path");
        RandomAccessFile file = null;
        try {
            file = new RandomAccessFile(path.toFile(), "rw");
            file.setLength(SEGMENT_SIZE);
            MappedByteBuffer map = file.getChannel().map(FileChannel.MapMode.READ_WRITE, 0, SEGMENT_SIZE);

            try (FileLock ignored = file.getChannel().lock(0, SEGMENT_SIZE, false)) {
                for (int i = 0; i < SEGMENT_SIZE; i++) {
                    map.put(i, (byte) 0);
                }
                map.putInt(COUNT_OFFSET, instanceCount);
                map.putInt(SYNC_POINT_OFFSET, BarrierRound.IDLE_SYNC_POINT);
                map.putInt(ARRIVED_OFFSET, 0);
                map.putInt(FAILED_OFFSET, 0);
                // magic last: openers treat a segment without it as not ready
                map.putInt(MAGIC_OFFSET, MAGIC);
                map.force();
            }

            log.info("Created shared segment {} for {} instances", path, instanceCount);
            return new SharedMemorySegment(path, file, map, instanceCount);
        } catch (IOException e) {
            closeQuietly(file);
            throw new SetupException("Failed to create shared segment " + path, e);
        }
    }

    /**
     * Opens a segment created by instance 0, retrying while it does not yet
     * exist or is not yet initialised.
     */
    public static SharedMemorySegment open(Path path, int instanceCount, ValidationTimingPolicy timing)
            throws SetupException
    {
        Objects.requireNonNull(path, "path");
        Objects.requireNonNull(timing, "timing");

        IOException last = null;
        for (int attempt = 1; attempt <= timing.connectAttempts(); attempt++) {
            if (Files.exists(path)) {
                RandomAccessFile file = null;
                try {
                    file = new RandomAccessFile(path.toFile(), "rw");
                    if (file.length() >= SEGMENT_SIZE) {
                        MappedByteBuffer map = file.getChannel().map(FileChannel.MapMode.READ_WRITE, 0, SEGMENT_SIZE);
                        if (map.getInt(MAGIC_OFFSET) == MAGIC) {
                            int count = map.getInt(COUNT_OFFSET);
                            if (count != instanceCount) {
                                closeQuietly(file);
                                throw new SetupException("Shared segment " + path + " is for " + count
                                        + " instances, expected " + instanceCount);
                            }
                            log.info("Opened shared segment {}", path);
                            return new SharedMemorySegment(path, file, map, instanceCount);
                        }
                    }
                    closeQuietly(file);
                } catch (IOException e) {
                    closeQuietly(file);
                    last = e;
                }
            }

            if (attempt < timing.connectAttempts()) {
                try {
                    Thread.sleep(timing.connectRetryDelay().toMillis());
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    throw new SetupException("Interrupted while opening shared segment " + path, e);
                }
            }
        }
        throw new SetupException("Shared segment " + path + " not available after "
                + timing.connectAttempts() + " attempts", last);
    }

    /**
     * One non-blocking attempt to lock the segment.
     *
     * @return the held lock, or {@code null} if another holder has it (in this
     *         process or another)
     */
    public FileLock tryLock() throws IOException
    {
        try {
            return channel.tryLock(0, SEGMENT_SIZE, false);
        } catch (OverlappingFileLockException e) {
            log.trace("Segment {} already locked within this process", path);
            return null;
        }
    }

    /**
     * Reads the live round. Call with the lock held.
     */
    public BarrierRound readRound()
    {
        int syncPoint = map.getInt(SYNC_POINT_OFFSET);
        if (syncPoint == BarrierRound.IDLE_SYNC_POINT) {
            return BarrierRound.idle(instanceCount);
        }
        int arrived = Math.min(map.getInt(ARRIVED_OFFSET), instanceCount);
        List<Arrival> arrivals = new ArrayList<>(arrived);
        for (int i = 0; i < arrived; i++) {
            int id = map.getInt(IDS_OFFSET + 4 * i);
            String text = getText(FINGERPRINTS_OFFSET + FINGERPRINT_SLOT_SIZE * i, FINGERPRINT_SLOT_SIZE);
            arrivals.add(new Arrival(id, Fingerprint.of(text)));
        }
        return new BarrierRound(syncPoint, instanceCount, arrivals);
    }

    /**
     * Writes {@code round} back as the live round. Call with the lock held.
     */
    public void writeRound(BarrierRound round)
    {
        map.putInt(SYNC_POINT_OFFSET, round.syncPoint());
        map.putInt(ARRIVED_OFFSET, round.arrivals().size());
        for (int i = 0; i < Participant.MAX_INSTANCES; i++) {
            int fpOffset = FINGERPRINTS_OFFSET + FINGERPRINT_SLOT_SIZE * i;
            if (i < round.arrivals().size()) {
                Arrival a = round.arrivals().get(i);
                map.putInt(IDS_OFFSET + 4 * i, a.instanceId());
                putText(fpOffset, FINGERPRINT_SLOT_SIZE, a.fingerprint().text());
            }
            else {
                map.putInt(IDS_OFFSET + 4 * i, 0);
                putText(fpOffset, FINGERPRINT_SLOT_SIZE, "");
            }
        }
    }

    /**
     * Sets the failed flag and records {@code detail}. Call with the lock held.
     */
    public void markFailed(String detail)
    {
        putText(DETAIL_OFFSET, DETAIL_SIZE, detail);
        map.putInt(FAILED_OFFSET, 1);
    }

    /**
     * Reads the failed flag. Safe without the lock; the flag only ever goes from 0 to 1.
     */
    public boolean validationFailed()
    {
        return map.getInt(FAILED_OFFSET) != 0;
    }

    public String mismatchDetail()
    {
        return getText(DETAIL_OFFSET, DETAIL_SIZE);
    }

    public void force()
    {
        map.force();
    }

    public Path path()
    {
        return path;
    }

    /**
     * Closes the file. The mapping itself is released when it is garbage collected.
     */
    @Override
    public void close() throws IOException
    {
        file.close();
    }

    private void putText(int offset, int fieldSize, String text)
    {
        byte[] utf8 = text.getBytes(StandardCharsets.UTF_8);
        int len = Math.min(utf8.length, fieldSize - 1);
        // never cut inside a multi-byte sequence
        while (len > 0 && len < utf8.length && (utf8[len] & 0xC0) == 0x80) {
            len--;
        }
        byte[] field = Arrays.copyOf(utf8, fieldSize);
        Arrays.fill(field, len, fieldSize, (byte) 0);
        map.put(offset, field);
    }

    private String getText(int offset, int fieldSize)
    {
        byte[] field = new byte[fieldSize];
        map.get(offset, field);
        int end = 0;
        while (end < fieldSize && field[end] != 0) {
            end++;
        }
        return new String(field, 0, end, StandardCharsets.UTF_8);
    }

    private static void closeQuietly(RandomAccessFile file)
    {
        if (file == null) {
            return;
        }
        try {
            file.close();
        } catch (IOException e) {
            log.debug("Ignoring close failure: {}", e.toString());
        }
    }
}
