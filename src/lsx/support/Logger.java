/* This code is part of LSX. It is distributed under the GNU General
 * Public License, version 2 (or at your option any later version). See
 * http://www.gnu.org/ for further details of the GPL. */
package lsx.support;

import java.io.PrintStream;
import java.lang.ref.WeakReference;
import java.lang.reflect.Field;
import java.lang.reflect.Modifier;

import lsx.support.LoggerHook.InvalidThresholdException;

/**
 * Global logging facade. Library code logs through the static methods; by
 * default everything goes to a {@link VoidLogger} until somebody calls
 * {@link #setupStdoutLogging(LogLevel, String)} or adds a hook.
 */
public abstract class Logger {

	/** These indicate the verbosity levels for calls to log() * */
	public enum LogLevel {
		MINIMAL, /** For being used to enable ALL logging. Do not use as log level for actual log messages. */
		DEBUG,
		MINOR,
		NORMAL,
		WARNING,
		ERROR,
		NONE; /** For being used to disable logging completely. Do not use as log level for actual log messages. */

		public boolean matchesThreshold(LogLevel threshold) {
			return this.ordinal() >= threshold.ordinal();
		}
	}

	/**
	 * Single global LoggerHook.
	 */
	static Logger logger = new VoidLogger();

	/** Log to standard output. */
	public synchronized static PrintStreamLoggerHook setupStdoutLogging(LogLevel level, String detail) throws InvalidThresholdException {
		return setupLogging(System.out, level, detail);
	}

	/** Log to the given stream, replacing any existing hooks. */
	public synchronized static PrintStreamLoggerHook setupLogging(PrintStream out, LogLevel level, String detail) throws InvalidThresholdException {
		// Parse everything before touching the global logger.
		PrintStreamLoggerHook hook = new PrintStreamLoggerHook(out, level);
		hook.setDetailedThresholds(detail);
		setupChain();
		logger.setThreshold(level);
		logger.setDetailedThresholds(detail);
		globalAddHook(hook);
		return hook;
	}

	/** Create a LoggerHookChain and set the global logger to be it. */
	public synchronized static void setupChain() {
		Logger old = logger;
		LoggerHookChain chain = new LoggerHookChain();
		logger = chain;
		// Keep the registered callbacks alive across the swap.
		if (old instanceof LoggerHook)
			((LoggerHook) old).moveCallbacksTo(chain);
	}

	// These methods log messages at various priorities using the global logger.

	public synchronized static void debug(Class<?> c, String s) {
		logger.log(c, s, LogLevel.DEBUG);
	}

	public synchronized static void debug(Object o, String s) {
		logger.log(o, s, LogLevel.DEBUG);
	}

	public synchronized static void error(Class<?> c, String s) {
		logger.log(c, s, LogLevel.ERROR);
	}

	public synchronized static void error(Class<?> c, String s, Throwable t) {
		logger.log(c, s, t, LogLevel.ERROR);
	}

	public synchronized static void error(Object o, String s) {
		logger.log(o, s, LogLevel.ERROR);
	}

	public synchronized static void error(Object o, String s, Throwable e) {
		logger.log(o, s, e, LogLevel.ERROR);
	}

	public synchronized static void minor(Class<?> c, String s) {
		logger.log(c, s, LogLevel.MINOR);
	}

	public synchronized static void minor(Object o, String s) {
		logger.log(o, s, LogLevel.MINOR);
	}

	public synchronized static void normal(Object o, String s) {
		logger.log(o, s, LogLevel.NORMAL);
	}

	public synchronized static void normal(Class<?> c, String s) {
		logger.log(c, s, LogLevel.NORMAL);
	}

	public synchronized static void warning(Class<?> c, String s) {
		logger.log(c, s, LogLevel.WARNING);
	}

	public synchronized static void warning(Object o, String s) {
		logger.log(o, s, LogLevel.WARNING);
	}

	public synchronized static void warning(Object o, String s, Throwable e) {
		logger.log(o, s, e, LogLevel.WARNING);
	}

	/**
	 * Log a message
	 *
	 * @param o
	 *            The object where this message was generated.
	 * @param source
	 *            The class where this message was generated.
	 * @param message
	 *            A clear and verbose message describing the event
	 * @param e
	 *            Logs this exception with the message.
	 * @param priority
	 *            The priority of the mesage, one of LogLevel.ERROR,
	 *            LogLevel.NORMAL, LogLevel.MINOR, or LogLevel.DEBUG.
	 */
	public abstract void log(
			Object o,
			Class<?> source,
			String message,
			Throwable e,
			LogLevel priority);

	/**
	 * Log a message.
	 * @param source        The source object where this message was generated
	 * @param message A clear and verbose message describing the event
	 * @param priority The priority of the mesage.
	 **/
	public abstract void log(Object source, String message, LogLevel priority);

	/**
	 * Log a message with an exception.
	 * @param o   The source object where this message was generated.
	 * @param message  A clear and verbose message describing the event.
	 * @param e        Logs this exception with the message.
	 * @param priority The priority of the mesage.
	 */
	public abstract void log(Object o, String message, Throwable e,
			LogLevel priority);

	/**
	 * Log a message from static code.
	 * @param c        The class where this message was generated.
	 * @param message  A clear and verbose message describing the event
	 * @param priority The priority of the mesage.
	 */
	public abstract void log(Class<?> c, String message, LogLevel priority);

	/**
	 * Log a message from static code.
	 * @param c     The class where this message was generated.
	 * @param message A clear and verbose message describing the event
	 * @param e        Logs this exception with the message.
	 * @param priority The priority of the mesage.
	 */
	public abstract void log(Class<?> c, String message, Throwable e,
			LogLevel priority);

	/** Should this specific Logger object log a message concerning the
	 * given class with the given priority. */
	public abstract boolean instanceShouldLog(LogLevel priority, Class<?> c);

	/** Would a message concerning an object of the given class be logged
	 * at the given priority by the global logger? */
	public synchronized static boolean shouldLog(LogLevel priority, Class<?> c) {
		return logger.instanceShouldLog(priority, c);
	}

	/** Would a message concerning the given object be logged
	 * at the given priority by the global logger? */
	public static boolean shouldLog(LogLevel priority, Object o) {
		return shouldLog(priority, o.getClass());
	}

	/** Should this specific Logger object log a message concerning the
	 * given object with the given priority. */
	public abstract boolean instanceShouldLog(LogLevel prio, Object o);

	/**
	 * Changes the priority threshold.
	 *
	 * @param thresh
	 *            The new threshhold
	 */
	public abstract void setThreshold(LogLevel thresh);

	/**
	 * Changes the priority threshold.
	 *
	 * @param symbolicThreshold
	 *            The new threshhold, must be one of ERROR,NORMAL etc..
	 * @throws InvalidThresholdException
	 */
	public abstract void setThreshold(String symbolicThreshold) throws InvalidThresholdException;

	/**
	 * @return The currently used logging threshold
	 */
	public abstract LogLevel getThreshold();

	/** Set the detailed list of thresholds. This allows to specify that
	 * we are interested in debug level logging for one class but are only
	 * interested in errors for another, which can be very useful for
	 * debugging. Format is classname:threshold,classname:threshold...
	 */
	public abstract void setDetailedThresholds(String details) throws InvalidThresholdException;

	/**
	 * Register a LogThresholdCallback; this callback will be called after registration,
	 * and whether the overall threshold or the detailed thresholds change in a way that
	 * would affect whether messages for the class registering will be logged.
	 */
	public synchronized static void registerLogThresholdCallback(LogThresholdCallback ltc) {
		logger.instanceRegisterLogThresholdCallback(ltc);
	}

	/** Register a log threshold callback with this specific logger, not with
	 * the global logger. */
	public abstract void instanceRegisterLogThresholdCallback(LogThresholdCallback ltc);

	/**
	 * Unregister a LogThresholdCallback.
	 */
	public synchronized static void unregisterLogThresholdCallback(LogThresholdCallback ltc) {
		logger.instanceUnregisterLogThresholdCallback(ltc);
	}

	/** Unregister a log threshold callback with this specific logger. */
	public abstract void instanceUnregisterLogThresholdCallback(LogThresholdCallback ltc);

	/** Register a class so that its logMINOR and logDEBUG fields (the
	 * latter is optional) are automatically updated whenever they should be
	 * i.e. whenever shouldLog(classname, MINOR) or ,DEBUG would change. */
	public static void registerClass(final Class<?> clazz) {
		LogThresholdCallback ltc = new LogThresholdCallback() {
			WeakReference<Class<?>> ref = new WeakReference<Class<?>> (clazz);

			@Override
			public void shouldUpdate() {
				Class<?> clazz = ref.get();
				if (clazz == null) {	// class unloaded
					unregisterLogThresholdCallback(this);
					return;
				}

				boolean done = setLevelField(clazz, "logMINOR", LogLevel.MINOR);
				done |= setLevelField(clazz, "logDEBUG", LogLevel.DEBUG);
				if (!done) Logger.error(this, "No log level field for " + clazz);
			}
		};

		registerLogThresholdCallback(ltc);
	}

	private static boolean setLevelField(Class<?> clazz, String name, LogLevel level) {
		try {
			Field field = clazz.getDeclaredField(name);
			if ((field.getModifiers() & Modifier.STATIC) == 0)
				return false;
			field.setAccessible(true);
			field.set(null, shouldLog(level, clazz));
			return true;
		} catch (NoSuchFieldException e) {
			return false;
		} catch (IllegalAccessException e) {
			throw new IllegalStateException("Cannot update " + name + " on " + clazz, e);
		}
	}

	/** Add a logger hook to the global logger hook chain. Messages which
	 * are not filtered out by the global logger hook chain's thresholds
	 * will be passed to this logger. */
	public synchronized static void globalAddHook(LoggerHook logger2) {
		getChain().addHook(logger2);
	}

	/** Set the global threshold. The global logger will ignore messages
	 * less significant than the given threshold. */
	public synchronized static void globalSetThreshold(LogLevel i) {
		logger.setThreshold(i);
	}

	/** What is the current global logging threshold? */
	public synchronized static LogLevel globalGetThreshold() {
		return logger.getThreshold();
	}

	/** Remove a logger hook from the global logger hook chain. */
	public synchronized static void globalRemoveHook(LoggerHook hook) {
		if (logger instanceof LoggerHookChain) {
			((LoggerHookChain)logger).removeHook(hook);
		}
	}

	/** Get the global logger hook chain, creating it if necessary. */
	public synchronized static LoggerHookChain getChain() {
		if (!(logger instanceof LoggerHookChain))
			setupChain();
		return (LoggerHookChain) logger;
	}

	/** Drop all hooks; everything logged from now on is discarded. Threshold
	 * callbacks stay registered and see the new (silent) levels. */
	public synchronized static void reset() {
		Logger old = logger;
		VoidLogger silent = new VoidLogger();
		logger = silent;
		if (old instanceof LoggerHook)
			((LoggerHook) old).moveCallbacksTo(silent);
	}
}
