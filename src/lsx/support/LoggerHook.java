/* This code is part of LSX. It is distributed under the GNU General
 * Public License, version 2 (or at your option any later version). See
 * http://www.gnu.org/ for further details of the GPL. */
package lsx.support;

import java.util.ArrayList;
import java.util.StringTokenizer;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * A logger with a global threshold and optional per-class thresholds. The
 * thresholds are matched by class name prefix, so "lsx.crypt:MINOR" turns on
 * MINOR logging for the whole crypt package.
 */
public abstract class LoggerHook extends Logger {

	protected LogLevel threshold;

	private static final class DetailedThreshold {
		final String section;
		final LogLevel dThreshold;
		DetailedThreshold(String section, LogLevel thresh) {
			this.section = section;
			this.dThreshold = thresh;
		}
	}

	protected LoggerHook(LogLevel thresh){
		this.threshold = thresh;
	}

	private DetailedThreshold[] detailedThresholds = new DetailedThreshold[0];
	private final CopyOnWriteArrayList<LogThresholdCallback> thresholdsCallbacks = new CopyOnWriteArrayList<LogThresholdCallback>();

	@Override
	public abstract void log(
			Object o,
			Class<?> source,
			String message,
			Throwable e,
			LogLevel priority);

	@Override
	public void log(Object source, String message, LogLevel priority) {
		if (!instanceShouldLog(priority,source)) return;
		log(source, source == null ? null : source.getClass(),
				message, null, priority);
	}

	@Override
	public void log(Object o, String message, Throwable e,
			LogLevel priority) {
		if (!instanceShouldLog(priority,o)) return;
		log(o, o == null ? null : o.getClass(), message, e, priority);
	}

	@Override
	public void log(Class<?> c, String message, LogLevel priority) {
		if (!instanceShouldLog(priority,c)) return;
		log(null, c, message, null, priority);
	}

	@Override
	public void log(Class<?> c, String message, Throwable e, LogLevel priority) {
		if (!instanceShouldLog(priority, c))
			return;
		log(null, c, message, e, priority);
	}

	@Override
	public void setThreshold(LogLevel thresh) {
		synchronized(this) {
			this.threshold = thresh;
		}
		notifyLogThresholdCallbacks();
	}

	@Override
	public synchronized LogLevel getThreshold() {
		return threshold;
	}

	static LogLevel parseThreshold(String threshold) throws InvalidThresholdException {
		if(threshold == null) throw new InvalidThresholdException(threshold);
		try {
			return LogLevel.valueOf(threshold.trim().toUpperCase());
		} catch (IllegalArgumentException e) {
			throw new InvalidThresholdException(threshold);
		}
	}

	@Override
	public void setThreshold(String symbolicThreshold) throws InvalidThresholdException {
		setThreshold(parseThreshold(symbolicThreshold));
	}

	@Override
	public void setDetailedThresholds(String details) throws InvalidThresholdException {
		if (details == null)
			return;
		StringTokenizer st = new StringTokenizer(details, ",", false);
		ArrayList<DetailedThreshold> stuff = new ArrayList<DetailedThreshold>();
		while (st.hasMoreTokens()) {
			String token = st.nextToken().trim();
			if (token.length() == 0)
				continue;
			int x = token.indexOf(':');
			if (x < 0)
				continue;
			if (x == token.length() - 1)
				continue;
			String section = token.substring(0, x);
			String value = token.substring(x + 1, token.length());
			stuff.add(new DetailedThreshold(section, parseThreshold(value)));
		}
		DetailedThreshold[] newThresholds = new DetailedThreshold[stuff.size()];
		stuff.toArray(newThresholds);
		synchronized(this) {
			detailedThresholds = newThresholds;
		}
		notifyLogThresholdCallbacks();
	}

	public String getDetailedThresholds() {
		DetailedThreshold[] thresh = null;
		synchronized(this) {
			thresh = detailedThresholds;
		}
		if (thresh.length == 0)
			return "";
		StringBuilder sb = new StringBuilder();
		for(DetailedThreshold t: thresh) {
			sb.append(t.section);
			sb.append(':');
			sb.append(t.dThreshold);
			sb.append(',');
		}
		// remove last ','
		sb.deleteCharAt(sb.length() - 1);
		return sb.toString();
	}

	public static class InvalidThresholdException extends Exception {
		private static final long serialVersionUID = -1;

		InvalidThresholdException(String msg) {
			super("Invalid log threshold: " + msg);
		}
	}

	@Override
	public boolean instanceShouldLog(LogLevel priority, Class<?> c) {
		DetailedThreshold[] thresholds;
		LogLevel thresh;
		synchronized(this) {
			thresholds = detailedThresholds;
			thresh = threshold;
		}
		if ((c != null) && (thresholds.length > 0)) {
			String cname = c.getName();
			for(DetailedThreshold dt : thresholds) {
				if(cname.startsWith(dt.section))
					thresh = dt.dThreshold;
			}
		}
		return priority.matchesThreshold(thresh);
	}

	@Override
	public final boolean instanceShouldLog(LogLevel prio, Object o) {
		return instanceShouldLog(prio, o == null ? null : o.getClass());
	}

	@Override
	public final void instanceRegisterLogThresholdCallback(LogThresholdCallback ltc) {
		thresholdsCallbacks.add(ltc);

		// Call the new callback to avoid code duplication
		ltc.shouldUpdate();
	}

	@Override
	public final void instanceUnregisterLogThresholdCallback(LogThresholdCallback ltc) {
		thresholdsCallbacks.remove(ltc);
	}

	/** Hand every registered callback over to another hook, which then
	 * tells them about its own thresholds. */
	final void moveCallbacksTo(LoggerHook other) {
		ArrayList<LogThresholdCallback> moving = new ArrayList<LogThresholdCallback>(thresholdsCallbacks);
		thresholdsCallbacks.clear();
		for(LogThresholdCallback ltc : moving)
			other.instanceRegisterLogThresholdCallback(ltc);
	}

	private void notifyLogThresholdCallbacks() {
		for(LogThresholdCallback ltc : thresholdsCallbacks)
			ltc.shouldUpdate();
	}

}
