package com.daveeberhart.backup_util.cloud_volumes.progress;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Progress reporting for long transfers, written to the log every {@code reportInterval} bytes.
 * <p>
 * Set {@code -Dnohup=true} to leave out the progress bar when the log isn't a console.
 *
 * @author deberhar
 */
public class BaseProgressListener {
  private static final Logger log = LoggerFactory.getLogger(BaseProgressListener.class);
  private static final int LINE_WIDTH = 79;

  private final boolean hasConsole = !Boolean.getBoolean("nohup");
  private final long reportInterval;
  private final String action;
  private final String caption;
  private final long totalBytes;

  private long nextReport;
  private boolean reportedAnything = false;
  private boolean hit100 = false;

  public BaseProgressListener(String caption, String action, long totalBytes, long reportInterval) {
    this.reportInterval = reportInterval;
    this.caption = caption;
    this.action = action;
    this.totalBytes = Math.max(1, totalBytes); // Cheat a bit and avoid div/0 errors.
    nextReport = reportInterval;
  }

  protected synchronized void reportProgress(long totalBytesProcessed) {
    if (nextReport <= totalBytesProcessed) {
      reportedAnything = true;
      nextReport = totalBytesProcessed + reportInterval;
      log.info(formatLine(totalBytesProcessed));
    }
  }

  /**
   * @return e.g. {@code [vol-0001] Upload  42% [=====     ]}
   */
  String formatLine(long totalBytesProcessed) {
    double dPercent = Math.min(100d, (100d * totalBytesProcessed) / totalBytes);
    long lPercent = Math.round(dPercent);
    StringBuilder sb = new StringBuilder(LINE_WIDTH);
    sb.append("[").append(caption).append("] ").append(action).append(" ");

    if (lPercent == 100) {
      hit100 = true;
    } else {
      sb.append(" ");
    }
    if (lPercent < 10) {
      sb.append(" ");
    }
    sb.append(lPercent).append("%");

    if (hasConsole) {
      sb.append(" [");
      int barWidth = Math.max(10, LINE_WIDTH - (sb.length() + 1));
      int cutoff = (int)(barWidth * dPercent / 100d);
      for (int i = 0; i < barWidth; i++) {
        sb.append(i <= cutoff ? '=' : ' ');
      }
      sb.append("]");
    }
    return sb.toString();
  }

  public synchronized void done() {
    if (reportedAnything && !hit100) {
      // If we made any prior reports, force a report of 100% since we're done...
      nextReport = 0;
      reportProgress(totalBytes);
    }
  }

}
