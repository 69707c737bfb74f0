package org.pygcse.dto;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

public class IRNodeDTO
{
	public String kind;
	public String text;
	public Map<String, Object> meta = new LinkedHashMap<>();
	public List<IRNodeDTO> children = new ArrayList<>();
}
