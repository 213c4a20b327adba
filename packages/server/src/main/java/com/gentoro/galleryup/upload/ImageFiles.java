package com.gentoro.galleryup.upload;

import com.gentoro.galleryup.exception.UploadException;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.stream.Stream;

/** Image file discovery shared by the scanner and the upload engine. */
public final class ImageFiles {
  public static final Set<String> EXTENSIONS = Set.of(".jpg", ".jpeg", ".png", ".gif");

  /**
   * Natural order: runs of digits compare numerically, everything else case-insensitively, so
   * {@code img2.jpg} sorts before {@code img10.jpg}.
   */
  public static final Comparator<String> NATURAL_ORDER = ImageFiles::compareNatural;

  private ImageFiles() {}

  public static boolean isImage(String fileName) {
    String lower = fileName.toLowerCase(Locale.ROOT);
    int dot = lower.lastIndexOf('.');
    return dot >= 0 && EXTENSIONS.contains(lower.substring(dot));
  }

  /** Names of the regular image files directly inside {@code folder}, in natural order. */
  public static List<String> list(Path folder) {
    if (!Files.isDirectory(folder)) {
      throw new UploadException("Folder not found: " + folder);
    }
    try (Stream<Path> entries = Files.list(folder)) {
      return entries
          .filter(Files::isRegularFile)
          .map(p -> p.getFileName().toString())
          .filter(ImageFiles::isImage)
          .sorted(NATURAL_ORDER)
          .toList();
    } catch (IOException e) {
      throw new UploadException("Cannot list folder " + folder, e);
    }
  }

  static int compareNatural(String a, String b) {
    int i = 0;
    int j = 0;
    while (i < a.length() && j < b.length()) {
      char ca = a.charAt(i);
      char cb = b.charAt(j);
      if (Character.isDigit(ca) && Character.isDigit(cb)) {
        int si = i;
        int sj = j;
        while (i < a.length() && Character.isDigit(a.charAt(i))) i++;
        while (j < b.length() && Character.isDigit(b.charAt(j))) j++;
        int cmp = compareDigits(a.substring(si, i), b.substring(sj, j));
        if (cmp != 0) return cmp;
      } else {
        int cmp = Character.compare(Character.toLowerCase(ca), Character.toLowerCase(cb));
        if (cmp != 0) return cmp;
        i++;
        j++;
      }
    }
    int rest = Integer.compare(a.length() - i, b.length() - j);
    return rest != 0 ? rest : a.compareTo(b);
  }

  private static int compareDigits(String x, String y) {
    String a = stripLeadingZeros(x);
    String b = stripLeadingZeros(y);
    if (a.length() != b.length()) {
      return Integer.compare(a.length(), b.length());
    }
    return a.compareTo(b);
  }

  private static String stripLeadingZeros(String digits) {
    int k = 0;
    while (k < digits.length() - 1 && digits.charAt(k) == '0') k++;
    return digits.substring(k);
  }
}
