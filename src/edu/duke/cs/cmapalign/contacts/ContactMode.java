/*
 * To change this license header, choose License Headers in Project Properties.
 * To change this template file, choose Tools | Templates
 * and open the template in the editor.
 */
package edu.duke.cs.cmapalign.contacts;

/**
 *
 * @author mhall44
 */
public enum ContactMode {
    DENSE,//full N x N matrix
    SPARSE//list of contacting index pairs
}
