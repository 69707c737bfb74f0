package org.pygcse.util;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.nio.file.Paths;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ConverterArgumentsTest
{
	@AfterEach
	void resetDebug()
	{
		Debug.ENABLE_DEBUG = false;
	}

	@Test
	void noArgumentsShowsHelp()
	{
		ConverterArguments args = ConverterArguments.parse(new String[0]);
		assertTrue(args.isHelpFlag());
		assertFalse(args.isInvalid());
	}

	@Test
	void flagsAndInputs()
	{
		ConverterArguments args = ConverterArguments.parse(new String[]{
				"--json", "--markdown", "--blank-lines", "--line-numbers", "--dump-ir", "--strict", "a.json", "b.json"});
		assertFalse(args.isHelpFlag());
		assertTrue(args.isJsonInput());
		assertTrue(args.isDumpIr());
		assertTrue(args.isStrict());
		assertTrue(args.getOptions().markdown());
		assertTrue(args.getOptions().blankLines());
		assertTrue(args.getOptions().lineNumbers());
		assertEquals(List.of(Paths.get("a.json"), Paths.get("b.json")), args.getInputFiles());
	}

	@Test
	void optionsWithValues()
	{
		ConverterArguments args = ConverterArguments.parse(new String[]{"--indent", "4", "--max-line", "60", "-o", "out.txt", "prog.py"});
		assertEquals(4, args.getOptions().indentSize());
		assertEquals(60, args.getOptions().maxLineLength());
		assertEquals(Paths.get("out.txt"), args.getOutputPath());
	}

	@Test
	void verboseEnablesDebugLogging()
	{
		ConverterArguments args = ConverterArguments.parse(new String[]{"-v", "prog.py"});
		assertTrue(args.isVerboseFlag());
		assertTrue(Debug.ENABLE_DEBUG);
	}

	@Test
	void versionStopsParsing()
	{
		assertTrue(ConverterArguments.parse(new String[]{"--version", "--bogus"}).isVersionFlag());
	}

	@Test
	void unknownOptionIsInvalid()
	{
		ConverterArguments args = ConverterArguments.parse(new String[]{"--bogus", "prog.py"});
		assertTrue(args.isHelpFlag());
		assertTrue(args.isInvalid());
	}

	@Test
	void badNumberIsInvalid()
	{
		assertTrue(ConverterArguments.parse(new String[]{"--indent", "two", "prog.py"}).isInvalid());
		assertTrue(ConverterArguments.parse(new String[]{"--max-line", "0", "prog.py"}).isInvalid());
	}

	@Test
	void missingValueIsInvalid()
	{
		assertTrue(ConverterArguments.parse(new String[]{"prog.py", "-o"}).isInvalid());
	}

	@Test
	void outputNeedsSingleInput()
	{
		assertTrue(ConverterArguments.parse(new String[]{"-o", "out.txt", "a.py", "b.py"}).isInvalid());
	}
}
