package org.pygcse;

import org.junit.jupiter.api.Test;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Every block opener in the output is closed by its matching keyword, at the
 * same indentation, in last-opened first-closed order.
 */
class BalancedBlocksTest
{
	private static final Map<String, String> CLOSERS = Map.of(
			"IF", "ENDIF",
			"FOR", "NEXT",
			"WHILE", "ENDWHILE",
			"REPEAT", "UNTIL",
			"PROCEDURE", "ENDPROCEDURE",
			"FUNCTION", "ENDFUNCTION",
			"TYPE", "ENDTYPE",
			"CLASS", "ENDCLASS",
			"CASE", "ENDCASE");

	private static final String PROGRAM = """
			# inventory
			class Item:
			    def __init__(self, name, qty):
			        self.name = name
			        self.qty = qty

			class Shop:
			    def __init__(self):
			        self.items = []
			    def add(self, item):
			        self.items.append(item)
			    def total(self):
			        count = 0
			        for item in self.items:
			            count += item.qty
			        return count

			def grade(score):
			    if score >= 70:
			        return "A"
			    elif score >= 50:
			        return "B"
			    else:
			        return "C"

			def menu():
			    while True:
			        choice = input("> ")
			        match choice:
			            case "q":
			                break
			            case _:
			                print(grade(int(choice)))

			stock = Item("pen", 3)
			n = 0
			while n < 3:
			    for i in range(n):
			        if i % 2 == 0:
			            print(i)
			    n += 1
			""";

	@Test
	void everyOpenedBlockIsClosed()
	{
		ConversionResult result = new PseudocodeConverter().convert(PROGRAM);
		assertFalse(result.hasErrors(), () -> result.errors().toString());

		Deque<String[]> open = new ArrayDeque<>();
		for (String line : result.code().split("\n"))
		{
			String trimmed = line.strip();
			if (trimmed.isEmpty() || trimmed.startsWith("//"))
			{
				continue;
			}
			String indent = line.substring(0, line.length() - line.stripLeading().length());
			String word = firstWord(trimmed);
			if (word.equals("PUBLIC") || word.equals("PRIVATE"))
			{
				word = firstWord(trimmed.substring(word.length()).strip());
			}

			if (CLOSERS.containsValue(word))
			{
				assertFalse(open.isEmpty(), "Unmatched " + trimmed);
				String[] opener = open.pop();
				assertEquals(CLOSERS.get(opener[0]), word, "Closing " + opener[0] + " with " + trimmed);
				assertEquals(opener[1], indent, "Indentation of " + trimmed);
			}
			else if (CLOSERS.containsKey(word))
			{
				open.push(new String[]{word, indent});
			}
		}
		assertTrue(open.isEmpty(), "Unclosed blocks: " + open.size());
	}

	private static String firstWord(String text)
	{
		int end = 0;
		while (end < text.length() && Character.isLetter(text.charAt(end)))
		{
			end++;
		}
		return text.substring(0, end);
	}
}
