package org.pygcse.util;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Path;
import java.nio.file.Paths;

import static org.junit.jupiter.api.Assertions.*;

class FileUtilsTest
{
	@TempDir
	Path tempDir;

	@Test
	void extensionHandling()
	{
		assertEquals(".py", FileUtils.getFileExtension(Paths.get("dir", "prog.py")));
		assertNull(FileUtils.getFileExtension(Paths.get("Makefile")));
		assertNull(FileUtils.getFileExtension(Paths.get(".hidden")));
		assertEquals(Paths.get("dir", "prog.pseudo"), FileUtils.replaceExtension(Paths.get("dir", "prog.py"), ".pseudo"));
		assertEquals(Paths.get("README.md"), FileUtils.replaceExtension(Paths.get("README"), ".md"));
	}

	@Test
	void writeCreatesParentsAndLoadReadsBack() throws IOException
	{
		Path target = tempDir.resolve("nested").resolve("out.pseudo");
		FileUtils.write(target, "x ← 1");
		assertEquals("x ← 1", FileUtils.load(target));
	}
}
