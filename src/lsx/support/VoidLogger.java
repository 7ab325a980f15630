/* This code is part of LSX. It is distributed under the GNU General
 * Public License, version 2 (or at your option any later version). See
 * http://www.gnu.org/ for further details of the GPL. */
package lsx.support;

/**
 * A LoggerHook implementation that just passes any supplied log messages on to /dev/null.
 * Threshold callbacks are still kept, so classes that cache their log flags
 * pick up the real levels once a chain replaces this logger.
 */
public class VoidLogger extends LoggerHook {

	public VoidLogger() {
		super(LogLevel.NONE);
	}

	@Override
	public void log(Object o, Class<?> source, String message, Throwable e, LogLevel priority) {
	}

	@Override
	public boolean instanceShouldLog(LogLevel priority, Class<?> c) {
		return false;
	}

	@Override
	public void setThreshold(LogLevel thresh) {
	}

	@Override
	public void setDetailedThresholds(String details) {
	}
}
