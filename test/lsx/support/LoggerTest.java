/* This code is part of LSX. It is distributed under the GNU General
 * Public License, version 2 (or at your option any later version). See
 * http://www.gnu.org/ for further details of the GPL. */
package lsx.support;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.containsString;
import static org.hamcrest.Matchers.instanceOf;
import static org.hamcrest.Matchers.not;
import static org.junit.Assert.*;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.io.UnsupportedEncodingException;

import org.junit.After;
import org.junit.Before;
import org.junit.Test;

import lsx.crypt.RawSHA256;
import lsx.crypt.ciphers.Twofish;
import lsx.support.Logger.LogLevel;
import lsx.support.LoggerHook.InvalidThresholdException;

public class LoggerTest {
	private ByteArrayOutputStream bytes;
	private PrintStream out;

	@Before
	public void setUp() {
		bytes = new ByteArrayOutputStream();
		out = new PrintStream(bytes, true);
	}

	@After
	public void tearDown() {
		Logger.reset();
	}

	private String logged() throws UnsupportedEncodingException {
		out.flush();
		return bytes.toString("UTF-8");
	}

	@Test
	public void testDefaultIsSilent() {
		Logger.reset();
		assertThat(Logger.logger, instanceOf(VoidLogger.class));
		assertFalse(Logger.shouldLog(LogLevel.ERROR, LoggerTest.class));
		Logger.error(LoggerTest.class, "nobody hears this");
	}

	@Test
	public void testThreshold() throws Exception {
		Logger.setupLogging(out, LogLevel.NORMAL, null);
		Logger.normal(LoggerTest.class, "shown");
		Logger.minor(LoggerTest.class, "hidden");
		String s = logged();
		assertThat(s, containsString("(lsx.support.LoggerTest, "));
		assertThat(s, containsString("NORMAL): shown"));
		assertThat(s, not(containsString("hidden")));
		assertEquals(LogLevel.NORMAL, Logger.globalGetThreshold());
	}

	@Test
	public void testDetailedThresholds() throws Exception {
		Logger.setupLogging(out, LogLevel.ERROR, "lsx.crypt:MINOR");
		assertTrue(Logger.shouldLog(LogLevel.MINOR, RawSHA256.class));
		assertFalse(Logger.shouldLog(LogLevel.WARNING, LoggerTest.class));

		new RawSHA256().finish();
		assertThat(logged(), containsString("Finished SHA-256 over 0 bytes"));
		assertEquals("lsx.crypt:MINOR", Logger.getChain().getDetailedThresholds());
	}

	@Test
	public void testExceptionIsPrinted() throws Exception {
		Logger.setupLogging(out, LogLevel.WARNING, null);
		try {
			Twofish.forKey(new byte[10]);
			fail();
		} catch (IllegalArgumentException e) {
			// Expected.
		}
		// forKey rejects the length itself, before the key schedule.
		assertThat(logged(), not(containsString("ERROR")));

		Logger.error(LoggerTest.class, "wrapped", new IllegalStateException("inner", new RuntimeException("root")));
		String s = logged();
		assertThat(s, containsString("ERROR): wrapped"));
		assertThat(s, containsString("java.lang.IllegalStateException: inner"));
		assertThat(s, containsString("java.lang.RuntimeException: root"));
		assertThat(s, containsString("\tat "));
	}

	@Test(expected = InvalidThresholdException.class)
	public void testInvalidThreshold() throws InvalidThresholdException {
		Logger.setupLogging(out, LogLevel.NORMAL, "lsx.crypt:LOUD");
	}

	@Test
	public void testBadDetailKeepsPreviousLogger() throws Exception {
		PrintStreamLoggerHook hook = Logger.setupLogging(out, LogLevel.NORMAL, null);
		LoggerHookChain chain = Logger.getChain();
		Logger.registerClass(LoggerTest.class);
		assertFalse(logMINOR);

		ByteArrayOutputStream other = new ByteArrayOutputStream();
		try {
			Logger.setupLogging(new PrintStream(other, true), LogLevel.MINIMAL, "lsx.crypt:LOUD");
			fail("Accepted an unknown level");
		} catch (InvalidThresholdException e) {
			// Expected.
		}
		assertSame(chain, Logger.getChain());
		assertArrayEquals(new LoggerHook[] { hook }, chain.getHooks());
		assertEquals(LogLevel.NORMAL, Logger.globalGetThreshold());
		assertFalse(logMINOR);

		Logger.normal(LoggerTest.class, "still here");
		assertThat(logged(), containsString("NORMAL): still here"));
		assertEquals(0, other.size());
	}

	@Test
	public void testSymbolicThreshold() throws InvalidThresholdException {
		PrintStreamLoggerHook hook = new PrintStreamLoggerHook(out, LogLevel.ERROR);
		hook.setThreshold("debug");
		assertEquals(LogLevel.DEBUG, hook.getThreshold());
	}

	@Test
	public void testRemoveHook() throws Exception {
		PrintStreamLoggerHook hook = Logger.setupLogging(out, LogLevel.MINIMAL, null);
		assertEquals(1, Logger.getChain().getHooks().length);
		Logger.globalRemoveHook(hook);
		assertEquals(0, Logger.getChain().getHooks().length);
		Logger.error(LoggerTest.class, "dropped");
		assertEquals("", logged());
	}

	private static volatile boolean logMINOR;
	private static volatile boolean logDEBUG;

	@Test
	public void testRegisteredClassFollowsThreshold() throws Exception {
		Logger.registerClass(LoggerTest.class);
		assertFalse(logMINOR);
		Logger.setupLogging(out, LogLevel.MINOR, null);
		assertTrue(logMINOR);
		assertFalse(logDEBUG);
		Logger.globalSetThreshold(LogLevel.DEBUG);
		assertTrue(logDEBUG);
		Logger.reset();
		assertFalse(logMINOR);
	}
}
