package org.pygcse.util;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

public class FileUtils
{
	public static String load(Path filePath) throws IOException
	{
		return Files.readString(filePath, StandardCharsets.UTF_8);
	}

	public static void write(Path filePath, String content) throws IOException
	{
		if (filePath.getParent() != null)
		{
			Files.createDirectories(filePath.getParent());
		}
		Files.writeString(filePath, content, StandardCharsets.UTF_8);
	}

	public static String getFileExtension(Path path)
	{
		String fileName = path.getFileName().toString();
		int lastDotIndex = fileName.lastIndexOf('.');
		if (lastDotIndex > 0)
		{
			return fileName.substring(lastDotIndex);
		}
		return null;
	}

	/**
	 * {@code dir/name.py} with {@code .pseudo} becomes {@code dir/name.pseudo}.
	 */
	public static Path replaceExtension(Path path, String extension)
	{
		String fileName = path.getFileName().toString();
		String ext = getFileExtension(path);
		String base = ext == null ? fileName : fileName.substring(0, fileName.length() - ext.length());
		return path.resolveSibling(base + extension);
	}
}
