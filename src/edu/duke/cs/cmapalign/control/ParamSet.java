/*
 * To change this license header, choose License Headers in Project Properties.
 * To change this template file, choose Tools | Templates
 * and open the template in the editor.
 */
package edu.duke.cs.cmapalign.control;

import java.io.BufferedReader;
import java.io.File;
import java.io.FileReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.io.Serializable;
import java.nio.charset.StandardCharsets;
import java.util.TreeMap;

/**
 *
 * Parameters read from config files: one "NAME value" per line
 * Names are case-insensitive; later files override earlier ones
 * Lines starting with # or % are comments
 *
 * @author mhall44
 */
@SuppressWarnings("serial")
public class ParamSet implements Serializable {

    public static final String DEFAULTS_RESOURCE = "/defaults.cfg";

    private TreeMap<String,String> params = new TreeMap<>();//keys are upper-case


    public static ParamSet withDefaults(){
        //parameter set preloaded with the defaults shipped on the classpath
        ParamSet ans = new ParamSet();
        InputStream is = ParamSet.class.getResourceAsStream(DEFAULTS_RESOURCE);
        if(is==null)
            throw new ConfigurationException("ERROR: can't find default parameters "+DEFAULTS_RESOURCE);
        try(Reader r = new InputStreamReader(is, StandardCharsets.UTF_8)){
            ans.addParams(r, DEFAULTS_RESOURCE);
        }
        catch(IOException e){
            throw new ConfigurationException("ERROR: can't read default parameters", e);
        }
        return ans;
    }


    public void addParamsFromFile(String fileName){
        File f = new File(fileName);
        try(Reader r = new FileReader(f, StandardCharsets.UTF_8)){
            addParams(r, fileName);
        }
        catch(IOException e){
            throw new ConfigurationException("ERROR: can't read config file "+fileName, e);
        }
    }


    void addParams(Reader r, String sourceName) throws IOException {
        BufferedReader br = new BufferedReader(r);
        String line;
        int lineNum = 0;
        while( (line=br.readLine()) != null ){
            lineNum++;
            line = line.trim();
            if(line.isEmpty() || line.startsWith("#") || line.startsWith("%"))
                continue;

            String[] parts = line.split("\\s+", 2);
            if(parts.length<2)
                throw new ConfigurationException("ERROR: no value for parameter "+parts[0]
                        +" at line "+lineNum+" of "+sourceName);
            setValue(parts[0], parts[1].trim());
        }
    }


    public void setValue(String paramName, String paramVal){
        params.put(paramName.toUpperCase(), paramVal);
    }

    public boolean contains(String paramName){
        return params.containsKey(paramName.toUpperCase());
    }

    public String getValue(String paramName){
        String val = params.get(paramName.toUpperCase());
        if(val==null)
            throw new ConfigurationException("ERROR: parameter "+paramName+" not set");
        return val;
    }

    public String getValue(String paramName, String defaultVal){
        String val = params.get(paramName.toUpperCase());
        return (val==null) ? defaultVal : val;
    }


    public int getInt(String paramName){
        return parseInt(paramName, getValue(paramName));
    }

    public int getInt(String paramName, int defaultVal){
        if(!contains(paramName))
            return defaultVal;
        return getInt(paramName);
    }

    public double getDouble(String paramName){
        String val = getValue(paramName);
        try {
            return Double.parseDouble(val);
        }
        catch(NumberFormatException e){
            throw new ConfigurationException("ERROR: parameter "+paramName+" should be a number, got "+val, e);
        }
    }

    public double getDouble(String paramName, double defaultVal){
        if(!contains(paramName))
            return defaultVal;
        return getDouble(paramName);
    }

    public boolean getBool(String paramName){
        String val = getValue(paramName);
        if(val.equalsIgnoreCase("TRUE"))
            return true;
        else if(val.equalsIgnoreCase("FALSE"))
            return false;
        throw new ConfigurationException("ERROR: parameter "+paramName+" should be true or false, got "+val);
    }

    public boolean getBool(String paramName, boolean defaultVal){
        if(!contains(paramName))
            return defaultVal;
        return getBool(paramName);
    }

    public File getFile(String paramName){
        return new File(getValue(paramName));
    }


    private static int parseInt(String paramName, String val){
        try {
            return Integer.parseInt(val);
        }
        catch(NumberFormatException e){
            throw new ConfigurationException("ERROR: parameter "+paramName+" should be an integer, got "+val, e);
        }
    }
}
