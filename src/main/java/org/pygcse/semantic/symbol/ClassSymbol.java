package org.pygcse.semantic.symbol;

import org.pygcse.ast.Expr;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * A user class as discovered from its definition. Attribute order follows
 * the {@code self.x = ...} assignments in the constructor.
 */
public class ClassSymbol
{
	private final String name;
	private final String base;
	private final boolean record;
	private final List<String> attributes = new ArrayList<>();
	private final List<String> constructorParams = new ArrayList<>();
	private final Map<String, String> paramTypes = new LinkedHashMap<>();
	private final Map<String, Expr> paramDefaults = new LinkedHashMap<>();
	// attribute -> constructor parameter it is copied from
	private final Map<String, String> bindings = new LinkedHashMap<>();
	// attribute -> value for attributes not copied from a parameter
	private final Map<String, Expr> initialValues = new LinkedHashMap<>();
	private final Map<String, String> fieldTypes = new LinkedHashMap<>();
	private boolean typeEmitted = false;

	public ClassSymbol(String name, String base, boolean record)
	{
		this.name = name;
		this.base = base;
		this.record = record;
	}

	public String getName()
	{
		return name;
	}

	public String getBase()
	{
		return base;
	}

	/**
	 * True for plain data holders: no base class and no method besides the constructor.
	 */
	public boolean isRecord()
	{
		return record;
	}

	public String getRecordTypeName()
	{
		return name + "Record";
	}

	public void addConstructorParam(String param, String annotatedType)
	{
		constructorParams.add(param);
		if (annotatedType != null)
		{
			paramTypes.put(param, annotatedType);
		}
	}

	public void setParamDefault(String param, Expr defaultValue)
	{
		paramDefaults.put(param, defaultValue);
	}

	public Expr getParamDefault(String param)
	{
		return paramDefaults.get(param);
	}

	public void addAttribute(String attribute, String boundParam, Expr initialValue)
	{
		if (!attributes.contains(attribute))
		{
			attributes.add(attribute);
		}
		if (boundParam != null)
		{
			bindings.put(attribute, boundParam);
		}
		else if (initialValue != null)
		{
			initialValues.put(attribute, initialValue);
		}
	}

	public List<String> getAttributes()
	{
		return attributes;
	}

	public List<String> getConstructorParams()
	{
		return constructorParams;
	}

	public String getBinding(String attribute)
	{
		return bindings.get(attribute);
	}

	public Expr getInitialValue(String attribute)
	{
		return initialValues.get(attribute);
	}

	public String getParamType(String param)
	{
		return paramTypes.get(param);
	}

	public String getFieldType(String attribute)
	{
		return fieldTypes.get(attribute);
	}

	public void setFieldType(String attribute, String type)
	{
		fieldTypes.put(attribute, type);
	}

	public boolean isTypeEmitted()
	{
		return typeEmitted;
	}

	public void markTypeEmitted()
	{
		this.typeEmitted = true;
	}
}
