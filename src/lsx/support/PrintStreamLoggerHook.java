/* This code is part of LSX. It is distributed under the GNU General
 * Public License, version 2 (or at your option any later version). See
 * http://www.gnu.org/ for further details of the GPL. */
package lsx.support;

import java.io.PrintStream;
import java.text.DateFormat;
import java.text.SimpleDateFormat;
import java.util.Date;
import java.util.TimeZone;

/**
 * Writes log lines to a PrintStream, one line per message in the form
 * <pre>date (class, thread, priority): message</pre>
 * followed by the stack trace and causes of any attached exception.
 */
public class PrintStreamLoggerHook extends LoggerHook {

	/** Upper bound on how many causes of one exception we print. */
	private static final int MAX_CAUSES = 20;

	private final PrintStream out;
	private final DateFormat df;
	private final Date myDate = new Date();

	public PrintStreamLoggerHook(PrintStream out, LogLevel threshold) {
		this(out, threshold, "MMM dd, yyyy HH:mm:ss:SSS");
	}

	public PrintStreamLoggerHook(PrintStream out, LogLevel threshold, String dateFormat) {
		super(threshold);
		this.out = out;
		this.df = new SimpleDateFormat(dateFormat);
		df.setTimeZone(TimeZone.getTimeZone("UTC"));
	}

	@Override
	public void log(Object o, Class<?> c, String msg, Throwable e, LogLevel priority) {
		if (!instanceShouldLog(priority, c))
			return;

		StringBuilder sb = new StringBuilder( e == null ? 512 : 1024 );
		long now = System.currentTimeMillis();
		synchronized (this) {
			myDate.setTime(now);
			sb.append(df.format(myDate));
		}
		sb.append(" (");
		sb.append(c == null ? "<none>" : c.getName());
		sb.append(", ");
		sb.append(Thread.currentThread().getName());
		sb.append(", ");
		sb.append(priority.name());
		sb.append("): ");
		sb.append(msg);
		sb.append('\n');

		// Write stacktrace if available
		for(int j=0;j<MAX_CAUSES && e != null;j++) {
			sb.append(e.toString());

			StackTraceElement[] trace = e.getStackTrace();

			if(trace == null)
				sb.append("(null)\n");
			else if(trace.length == 0)
				sb.append("(no stack trace)\n");
			else {
				sb.append('\n');
				for(int i=0;i<trace.length;i++) {
					sb.append("\tat ");
					sb.append(trace[i].toString());
					sb.append('\n');
				}
			}

			Throwable cause = e.getCause();
			if(cause != e) e = cause;
			else break;
		}

		synchronized (out) {
			out.print(sb);
			out.flush();
		}
	}
}
