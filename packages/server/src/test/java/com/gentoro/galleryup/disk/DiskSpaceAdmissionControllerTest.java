package com.gentoro.galleryup.disk;

import static org.junit.jupiter.api.Assertions.*;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class DiskSpaceAdmissionControllerTest {
  private static final long MB = 1024L * 1024L;

  @TempDir Path dataDir;
  @TempDir Path tempDir;

  private FakeProbe probe;
  private DiskSpaceAdmissionController controller;

  @BeforeEach
  void setUp() {
    probe = new FakeProbe();
    controller =
        new DiskSpaceAdmissionController(
            dataDir, tempDir, DiskThresholds.ofMegabytes(2048, 1024, 512), probe);
  }

  @AfterEach
  void tearDown() {
    controller.close();
  }

  @Test
  @DisplayName("Tier boundaries follow the thresholds")
  void tierBoundaries() {
    assertEquals(DiskTier.OK, controller.calculateTier(2048 * MB));
    assertEquals(DiskTier.WARNING, controller.calculateTier(2048 * MB - 1));
    assertEquals(DiskTier.CRITICAL, controller.calculateTier(1024 * MB - 1));
    assertEquals(DiskTier.EMERGENCY, controller.calculateTier(512 * MB - 1));
  }

  @Test
  @DisplayName("Poll interval tightens as free space shrinks")
  void intervals() {
    assertEquals(60_000, controller.calculateInterval(5000 * MB));
    assertEquals(15_000, controller.calculateInterval(3000 * MB));
    assertEquals(5_000, controller.calculateInterval(1500 * MB));
    assertEquals(2_000, controller.calculateInterval(800 * MB));
  }

  @Test
  @DisplayName("The smaller of data and temp free space decides the tier")
  void minOfBothDirectories() {
    probe.data = 10_000 * MB;
    probe.temp = 900 * MB;
    controller.poll();

    assertEquals(DiskTier.CRITICAL, controller.getCurrentTier());
    assertFalse(controller.canStartUpload());
    assertEquals(10_000 * MB, controller.getDataFree());
    assertEquals(900 * MB, controller.getTempFree());
  }

  @Test
  @DisplayName("Warning tier still admits uploads")
  void warningAdmits() {
    probe.data = 1500 * MB;
    probe.temp = 1500 * MB;
    controller.poll();
    assertEquals(DiskTier.WARNING, controller.getCurrentTier());
    assertTrue(controller.canStartUpload());
  }

  @Test
  @DisplayName("Entering emergency deletes the reserve file")
  void emergencyDeletesReserve() {
    controller.ensureReserveFile();
    assertTrue(Files.exists(controller.getReservePath()));

    List<DiskTier> transitions = new ArrayList<>();
    controller.addListener(
        new DiskSpaceListener() {
          @Override
          public void onTierChanged(DiskTier previous, DiskTier current) {
            transitions.add(current);
          }
        });
    probe.data = 100 * MB;
    probe.temp = 100 * MB;
    controller.poll();

    assertEquals(DiskTier.EMERGENCY, controller.getCurrentTier());
    assertEquals(List.of(DiskTier.EMERGENCY), transitions);
    assertFalse(Files.exists(controller.getReservePath()));
    assertEquals(0, controller.requestEmergencySpace());
  }

  @Test
  @DisplayName("A failed read keeps the previous tier")
  void failedReadKeepsTier() {
    probe.data = 800 * MB;
    probe.temp = 800 * MB;
    controller.poll();
    assertEquals(DiskTier.CRITICAL, controller.getCurrentTier());

    probe.fail = true;
    controller.poll();
    assertEquals(DiskTier.CRITICAL, controller.getCurrentTier());
    assertEquals(800 * MB, controller.getDataFree());
  }

  @Test
  void thresholdUpdateAppliesToNextPoll() {
    probe.data = 1500 * MB;
    probe.temp = 1500 * MB;
    controller.poll();
    assertEquals(DiskTier.WARNING, controller.getCurrentTier());

    controller.updateThresholds(1000, 500, 100);
    controller.poll();
    assertEquals(DiskTier.OK, controller.getCurrentTier());
  }

  @Test
  void archiveNeedsCriticalMargin() {
    probe.data = 3000 * MB;
    probe.temp = 3000 * MB;
    controller.poll();
    assertTrue(controller.canCreateArchive(1000 * MB));
    assertFalse(controller.canCreateArchive(2000 * MB));
  }

  @Test
  @DisplayName("Shrinking free space walks OK, WARNING, CRITICAL, EMERGENCY; reserve goes last")
  void shrinkingFreeSpaceWalksEveryTier() {
    controller.close();
    controller =
        new DiskSpaceAdmissionController(
            dataDir, tempDir, DiskThresholds.ofMegabytes(2048, 512, 100), probe);
    controller.ensureReserveFile();
    List<DiskTier> transitions = new ArrayList<>();
    controller.addListener(
        new DiskSpaceListener() {
          @Override
          public void onTierChanged(DiskTier previous, DiskTier current) {
            transitions.add(current);
          }
        });

    setFree(5000 * MB);
    assertEquals(DiskTier.OK, controller.getCurrentTier());
    assertTrue(controller.canStartUpload());

    setFree(1500 * MB);
    assertEquals(DiskTier.WARNING, controller.getCurrentTier());
    assertTrue(controller.canStartUpload());
    assertTrue(Files.exists(controller.getReservePath()));

    setFree(300 * MB);
    assertEquals(DiskTier.CRITICAL, controller.getCurrentTier());
    assertFalse(controller.canStartUpload());
    assertTrue(Files.exists(controller.getReservePath()));

    setFree(50 * MB);
    assertEquals(DiskTier.EMERGENCY, controller.getCurrentTier());
    assertFalse(controller.canStartUpload());
    assertFalse(Files.exists(controller.getReservePath()));

    assertEquals(List.of(DiskTier.WARNING, DiskTier.CRITICAL, DiskTier.EMERGENCY), transitions);
  }

  @Test
  @DisplayName("Emergency space frees the 20 MB reserve once, then nothing")
  void emergencySpaceFreesReserveOnce() throws IOException {
    controller.start();
    assertTrue(Files.exists(controller.getReservePath()));
    assertEquals(
        DiskSpaceAdmissionController.RESERVE_SIZE_BYTES,
        Files.size(controller.getReservePath()));

    long freed = controller.requestEmergencySpace();
    assertEquals(DiskSpaceAdmissionController.RESERVE_SIZE_BYTES, freed);
    assertFalse(Files.exists(controller.getReservePath()));
    assertEquals(0, controller.requestEmergencySpace());
  }

  @Test
  void hugeArchiveEstimateIsRefused() {
    probe.data = 3000 * MB;
    probe.temp = 3000 * MB;
    controller.poll();
    assertFalse(controller.canCreateArchive(Long.MAX_VALUE));
    assertFalse(controller.canCreateArchive(Long.MAX_VALUE - 1024 * MB));
  }

  private void setFree(long bytes) {
    probe.data = bytes;
    probe.temp = bytes;
    controller.poll();
  }

  private final class FakeProbe implements FreeSpaceProbe {
    volatile long data = 100_000 * MB;
    volatile long temp = 100_000 * MB;
    volatile boolean fail;

    @Override
    public long freeBytes(Path path) throws IOException {
      if (fail) {
        throw new IOException("free space unavailable");
      }
      return path.equals(tempDir) ? temp : data;
    }

    @Override
    public boolean sameStore(Path a, Path b) {
      return false;
    }
  }
}
