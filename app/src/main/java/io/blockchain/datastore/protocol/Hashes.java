package io.blockchain.datastore.protocol;

import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;

public final class Hashes {
    private Hashes(){}

    public static byte[] sha256(byte[] in){
        try {
            return MessageDigest.getInstance("SHA-256").digest(in);
        } catch (NoSuchAlgorithmException e) {
            throw new RuntimeException("SHA-256 not available", e);
        }
    }

    /** SHA-256 over the concatenation of all parts. */
    public static byte[] sha256(byte[]... parts){
        try {
            MessageDigest md = MessageDigest.getInstance("SHA-256");
            for (byte[] part : parts) {
                if (part != null) md.update(part);
            }
            return md.digest();
        } catch (NoSuchAlgorithmException e) {
            throw new RuntimeException("SHA-256 not available", e);
        }
    }

    public static String hex(byte[] b){
        final char[] HEX="0123456789abcdef".toCharArray();
        char[] out=new char[b.length*2];
        for(int i=0,j=0;i<b.length;i++){int v=b[i]&0xff;out[j++]=HEX[v>>>4];out[j++]=HEX[v&0x0f];}
        return new String(out);
    }
}
